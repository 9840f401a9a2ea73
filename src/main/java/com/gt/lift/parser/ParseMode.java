package com.gt.lift.parser;

public enum ParseMode {
    // Any schema violation aborts the parse
    STRICT,
    // Constructs with schema violations are skipped and reported as issues
    LENIENT
}
