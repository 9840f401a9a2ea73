package com.gt.lift.exception;

// Thrown by the generator when a model value breaks a precondition, e.g. an entry without an id
public class InvalidLiftModelException extends RuntimeException {

    public InvalidLiftModelException(String errMsg) {
        super(errMsg);
    }

    public InvalidLiftModelException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
