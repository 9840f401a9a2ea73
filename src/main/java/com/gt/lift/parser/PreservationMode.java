package com.gt.lift.parser;

public enum PreservationMode {
    // Unmodeled elements are reported and dropped
    KNOWN_SUBSET,
    // Unmodeled children of entries, senses, variants, pronunciations, examples and the header are kept verbatim
    STRICT_LOSSLESS
}
