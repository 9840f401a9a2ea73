package com.gt.lift.ranges;

import com.gt.lift.parser.ParseIssue;

import java.util.List;

public record RangesParseResult(RangesRegistry registry, List<ParseIssue> issues) {

    public RangesParseResult {
        issues = List.copyOf(issues);
    }
}
