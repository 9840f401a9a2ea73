package com.gt.lift.model;

import java.util.List;

// File-scoped metadata. Independent of the entries it precedes.
public record LiftHeader(Multitext description,
                         String rangesHref,
                         List<RangeReference> rangeReferences,
                         List<FieldDeclaration> fieldDeclarations,
                         List<ExtensionElement> extensions) {

    public static final LiftHeader EMPTY = new LiftHeader(Multitext.EMPTY, null, List.of(), List.of(), List.of());

    public LiftHeader {
        description = Models.textOf(description);
        rangesHref = Models.blankToNull(rangesHref);
        rangeReferences = Models.listOf(rangeReferences);
        fieldDeclarations = Models.listOf(fieldDeclarations);
        extensions = Models.listOf(extensions);
    }

    public LiftHeader(Multitext description, String rangesHref, List<FieldDeclaration> fieldDeclarations) {
        this(description, rangesHref, List.of(), fieldDeclarations, List.of());
    }

    public boolean isEmpty() {
        return description.isEmpty()
                && rangesHref == null
                && rangeReferences.isEmpty()
                && fieldDeclarations.isEmpty()
                && extensions.isEmpty();
    }
}
