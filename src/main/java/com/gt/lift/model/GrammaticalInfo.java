package com.gt.lift.model;

import java.util.List;

// Part-of-speech value; its traits are scoped to the grammatical info, not to the owner
public record GrammaticalInfo(String value, List<Trait> traits) {

    public GrammaticalInfo {
        traits = Models.listOf(traits);
    }

    public GrammaticalInfo(String value) {
        this(value, List.of());
    }
}
