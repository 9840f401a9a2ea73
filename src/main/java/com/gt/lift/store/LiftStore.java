package com.gt.lift.store;

public interface LiftStore {

    byte[] read(String name);

    void write(String name, byte[] content);

    boolean exists(String name);
}
