package com.gt.lift.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A sense of an {@link Entry}. The id may be absent; it is never synthesized by the codec.
 * Subsenses nest recursively, bounded by the parser's configured depth.
 */
public record Sense(String id,
                    Integer order,
                    GrammaticalInfo grammaticalInfo,
                    Multitext gloss,
                    Multitext definition,
                    List<Relation> relations,
                    List<Example> examples,
                    List<Note> notes,
                    List<Field> fields,
                    List<Trait> traits,
                    List<Annotation> annotations,
                    List<Sense> subsenses,
                    List<ExtensionElement> extensions) {

    public Sense {
        gloss = Models.textOf(gloss);
        definition = Models.textOf(definition);
        relations = Models.listOf(relations);
        examples = Models.listOf(examples);
        notes = Models.listOf(notes);
        fields = Models.listOf(fields);
        traits = Models.listOf(traits);
        annotations = Models.listOf(annotations);
        subsenses = Models.listOf(subsenses);
        extensions = Models.listOf(extensions);
    }

    // Depth-first search through this sense and its subsenses
    public Optional<Sense> findSense(String senseId) {
        if (senseId.equals(id)) {
            return Optional.of(this);
        }
        for (Sense subsense : subsenses) {
            Optional<Sense> found = subsense.findSense(senseId);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public Sense withId(String id) {
        return toBuilder().id(id).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.order = order;
        builder.grammaticalInfo = grammaticalInfo;
        builder.gloss = gloss;
        builder.definition = definition;
        builder.relations.addAll(relations);
        builder.examples.addAll(examples);
        builder.notes.addAll(notes);
        builder.fields.addAll(fields);
        builder.traits.addAll(traits);
        builder.annotations.addAll(annotations);
        builder.subsenses.addAll(subsenses);
        builder.extensions.addAll(extensions);
        return builder;
    }

    public static class Builder {
        private String id;
        private Integer order;
        private GrammaticalInfo grammaticalInfo;
        private Multitext gloss = Multitext.EMPTY;
        private Multitext definition = Multitext.EMPTY;
        private final List<Relation> relations = new ArrayList<>();
        private final List<Example> examples = new ArrayList<>();
        private final List<Note> notes = new ArrayList<>();
        private final List<Field> fields = new ArrayList<>();
        private final List<Trait> traits = new ArrayList<>();
        private final List<Annotation> annotations = new ArrayList<>();
        private final List<Sense> subsenses = new ArrayList<>();
        private final List<ExtensionElement> extensions = new ArrayList<>();

        private Builder() { }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder order(Integer order) {
            this.order = order;
            return this;
        }

        public Builder grammaticalInfo(GrammaticalInfo grammaticalInfo) {
            this.grammaticalInfo = grammaticalInfo;
            return this;
        }

        public Builder gloss(Multitext gloss) {
            this.gloss = gloss;
            return this;
        }

        public Builder definition(Multitext definition) {
            this.definition = definition;
            return this;
        }

        public Builder relation(Relation relation) {
            relations.add(relation);
            return this;
        }

        public Builder example(Example example) {
            examples.add(example);
            return this;
        }

        public Builder note(Note note) {
            notes.add(note);
            return this;
        }

        public Builder field(Field field) {
            fields.add(field);
            return this;
        }

        public Builder trait(Trait trait) {
            traits.add(trait);
            return this;
        }

        public Builder trait(String name, String value) {
            return trait(new Trait(name, value));
        }

        public Builder annotation(Annotation annotation) {
            annotations.add(annotation);
            return this;
        }

        public Builder subsense(Sense subsense) {
            subsenses.add(subsense);
            return this;
        }

        public Builder clearSubsenses() {
            subsenses.clear();
            return this;
        }

        public Builder extension(ExtensionElement extension) {
            extensions.add(extension);
            return this;
        }

        public Sense build() {
            return new Sense(id, order, grammaticalInfo, gloss, definition, relations, examples, notes, fields,
                    traits, annotations, subsenses, extensions);
        }
    }
}
