package com.gt.lift.exception;

public class LiftStoreException extends RuntimeException {

    public LiftStoreException(String errMsg)  {
        super(errMsg);
    }

    public LiftStoreException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
