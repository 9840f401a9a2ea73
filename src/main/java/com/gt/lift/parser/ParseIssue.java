package com.gt.lift.parser;

public record ParseIssue(IssueType type, String path, String message) {
}
