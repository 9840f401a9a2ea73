package com.gt.lift.model;

public record Annotation(String name, String value, String who, String when, Multitext content) {

    public Annotation {
        content = Models.textOf(content);
    }
}
