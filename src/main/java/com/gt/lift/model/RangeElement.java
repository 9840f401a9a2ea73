package com.gt.lift.model;

import java.util.List;

// parent is the id of another element in the same range, for hierarchical ranges like semantic-domain
public record RangeElement(String id,
                           String guid,
                           String parent,
                           Multitext label,
                           Multitext description,
                           Multitext abbrev,
                           List<Trait> traits) {

    public RangeElement {
        label = Models.textOf(label);
        description = Models.textOf(description);
        abbrev = Models.textOf(abbrev);
        traits = Models.listOf(traits);
    }

    public RangeElement(String id, String parent, Multitext label) {
        this(id, null, parent, label, Multitext.EMPTY, Multitext.EMPTY, List.of());
    }
}
