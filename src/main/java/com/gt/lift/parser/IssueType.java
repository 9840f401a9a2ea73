package com.gt.lift.parser;

public enum IssueType {
    SCHEMA_VIOLATION,
    UNKNOWN_CONSTRUCT,
    UNRESOLVED_NAMESPACE
}
