package com.gt.lift.parser;

import com.gt.lift.model.LiftDocument;

import java.util.List;

/**
 * Outcome of a parse: the document, every non-fatal issue met on the way, and the {@code version}
 * attribute of the source root (null for fragments).
 */
public record LiftParseResult(LiftDocument document, List<ParseIssue> issues, String sourceVersion) {

    public LiftParseResult {
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public List<ParseIssue> issues(IssueType type) {
        return issues.stream().filter(issue -> issue.type() == type).toList();
    }

    // Paths of the constructs dropped because of schema violations (lenient mode only)
    public List<String> skippedPaths() {
        return issues(IssueType.SCHEMA_VIOLATION).stream().map(ParseIssue::path).toList();
    }
}
