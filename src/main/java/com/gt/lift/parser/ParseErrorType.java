package com.gt.lift.parser;

public enum ParseErrorType {
    // Not well-formed XML; always aborts the whole parse
    MALFORMED_XML,
    // A required attribute or element of a modeled construct is missing
    SCHEMA_VIOLATION
}
