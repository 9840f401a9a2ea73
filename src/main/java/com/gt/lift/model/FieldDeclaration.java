package com.gt.lift.model;

// Custom field type declared in the header, with its description
public record FieldDeclaration(String type, Multitext description) {

    public FieldDeclaration {
        description = Models.textOf(description);
    }

    public FieldDeclaration(String type) {
        this(type, Multitext.EMPTY);
    }
}
