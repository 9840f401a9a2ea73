package com.gt.lift.model;

import java.util.List;

// Controlled vocabulary loaded from a .lift-ranges document
public record Range(String id,
                    String guid,
                    String href,
                    Multitext label,
                    Multitext description,
                    Multitext abbrev,
                    List<RangeElement> elements) {

    public Range {
        label = Models.textOf(label);
        description = Models.textOf(description);
        abbrev = Models.textOf(abbrev);
        elements = Models.listOf(elements);
    }

    public Range(String id, List<RangeElement> elements) {
        this(id, null, null, Multitext.EMPTY, Multitext.EMPTY, Multitext.EMPTY, elements);
    }
}
