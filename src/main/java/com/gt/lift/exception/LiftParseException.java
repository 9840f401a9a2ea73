package com.gt.lift.exception;

import com.gt.lift.parser.ParseErrorType;

// Fatal parse failure, carrying the path of the offending element when one is known
public class LiftParseException extends Exception {

    private final ParseErrorType errorType;
    private final String path;

    public LiftParseException(ParseErrorType errorType, String path, String msg) {
        super(formatMessage(errorType, path, msg));
        this.errorType = errorType;
        this.path = path;
    }

    public LiftParseException(ParseErrorType errorType, String path, String msg, Exception ex) {
        super(formatMessage(errorType, path, msg), ex);
        this.errorType = errorType;
        this.path = path;
    }

    public ParseErrorType getErrorType() {
        return errorType;
    }

    public String getPath() {
        return path;
    }

    private static String formatMessage(ParseErrorType errorType, String path, String msg) {
        return path == null || path.isEmpty()
                ? errorType + ": " + msg
                : errorType + " at " + path + ": " + msg;
    }
}
