package com.gt.lift.model;

import java.util.List;
import java.util.Optional;

public record Field(String type, Multitext content, List<Trait> traits) {

    public Field {
        content = Models.textOf(content);
        traits = Models.listOf(traits);
    }

    public Field(String type, Multitext content) {
        this(type, content, List.of());
    }

    public static Optional<Field> find(List<Field> fields, String type) {
        return fields.stream().filter(field -> type.equals(field.type())).findFirst();
    }
}
