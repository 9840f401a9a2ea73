package com.gt.lift.model;

import java.util.List;

public record Etymology(String type, String source, Multitext form, Multitext gloss, List<Field> fields, List<Trait> traits) {

    public Etymology {
        form = Models.textOf(form);
        gloss = Models.textOf(gloss);
        fields = Models.listOf(fields);
        traits = Models.listOf(traits);
    }
}
