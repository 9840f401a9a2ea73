package com.gt.lift.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A lexical entry. {@code id} is the join key for relation refs and must be present before the entry
 * can be generated; refs pointing at ids outside the document are allowed and kept as they are.
 */
public record Entry(String id,
                    String guid,
                    Integer order,
                    String dateCreated,
                    String dateModified,
                    String dateDeleted,
                    Multitext lexicalUnit,
                    Multitext citationForm,
                    GrammaticalInfo grammaticalInfo,
                    List<Pronunciation> pronunciations,
                    List<Sense> senses,
                    List<Variant> variants,
                    List<Relation> relations,
                    List<Etymology> etymologies,
                    List<Note> notes,
                    List<Field> fields,
                    List<Trait> traits,
                    List<Annotation> annotations,
                    List<ExtensionElement> extensions) {

    public Entry {
        lexicalUnit = Models.textOf(lexicalUnit);
        citationForm = Models.textOf(citationForm);
        pronunciations = Models.listOf(pronunciations);
        senses = Models.listOf(senses);
        variants = Models.listOf(variants);
        relations = Models.listOf(relations);
        etymologies = Models.listOf(etymologies);
        notes = Models.listOf(notes);
        fields = Models.listOf(fields);
        traits = Models.listOf(traits);
        annotations = Models.listOf(annotations);
        extensions = Models.listOf(extensions);
    }

    public String headword() {
        return !citationForm.isEmpty() ? citationForm.first() : lexicalUnit.first();
    }

    // Direct variants first, then relations carrying a variant-type trait
    public List<VariantLike> allVariants() {
        return Stream.concat(variants.stream(), relations.stream().filter(Relation::isVariantRelation))
                .map(VariantLike.class::cast)
                .toList();
    }

    public Optional<Sense> findSense(String senseId) {
        for (Sense sense : senses) {
            Optional<Sense> found = sense.findSense(senseId);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public boolean isDeleted() {
        return dateDeleted != null && !dateDeleted.isBlank();
    }

    public Entry withId(String id) {
        return toBuilder().id(id).build();
    }

    public Entry withSenses(List<Sense> senses) {
        return toBuilder().senses(senses).build();
    }

    public Entry withRelations(List<Relation> relations) {
        return toBuilder().relations(relations).build();
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.guid = guid;
        builder.order = order;
        builder.dateCreated = dateCreated;
        builder.dateModified = dateModified;
        builder.dateDeleted = dateDeleted;
        builder.lexicalUnit = lexicalUnit;
        builder.citationForm = citationForm;
        builder.grammaticalInfo = grammaticalInfo;
        builder.pronunciations.addAll(pronunciations);
        builder.senses.addAll(senses);
        builder.variants.addAll(variants);
        builder.relations.addAll(relations);
        builder.etymologies.addAll(etymologies);
        builder.notes.addAll(notes);
        builder.fields.addAll(fields);
        builder.traits.addAll(traits);
        builder.annotations.addAll(annotations);
        builder.extensions.addAll(extensions);
        return builder;
    }

    public static class Builder {
        private String id;
        private String guid;
        private Integer order;
        private String dateCreated;
        private String dateModified;
        private String dateDeleted;
        private Multitext lexicalUnit = Multitext.EMPTY;
        private Multitext citationForm = Multitext.EMPTY;
        private GrammaticalInfo grammaticalInfo;
        private final List<Pronunciation> pronunciations = new ArrayList<>();
        private final List<Sense> senses = new ArrayList<>();
        private final List<Variant> variants = new ArrayList<>();
        private final List<Relation> relations = new ArrayList<>();
        private final List<Etymology> etymologies = new ArrayList<>();
        private final List<Note> notes = new ArrayList<>();
        private final List<Field> fields = new ArrayList<>();
        private final List<Trait> traits = new ArrayList<>();
        private final List<Annotation> annotations = new ArrayList<>();
        private final List<ExtensionElement> extensions = new ArrayList<>();

        private Builder() { }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder guid(String guid) {
            this.guid = guid;
            return this;
        }

        public Builder order(Integer order) {
            this.order = order;
            return this;
        }

        public Builder dateCreated(String dateCreated) {
            this.dateCreated = dateCreated;
            return this;
        }

        public Builder dateModified(String dateModified) {
            this.dateModified = dateModified;
            return this;
        }

        public Builder dateDeleted(String dateDeleted) {
            this.dateDeleted = dateDeleted;
            return this;
        }

        public Builder lexicalUnit(Multitext lexicalUnit) {
            this.lexicalUnit = lexicalUnit;
            return this;
        }

        public Builder citationForm(Multitext citationForm) {
            this.citationForm = citationForm;
            return this;
        }

        public Builder grammaticalInfo(GrammaticalInfo grammaticalInfo) {
            this.grammaticalInfo = grammaticalInfo;
            return this;
        }

        public Builder pronunciation(Pronunciation pronunciation) {
            pronunciations.add(pronunciation);
            return this;
        }

        public Builder sense(Sense sense) {
            senses.add(sense);
            return this;
        }

        public Builder senses(List<Sense> senses) {
            this.senses.clear();
            this.senses.addAll(senses);
            return this;
        }

        public Builder variant(Variant variant) {
            variants.add(variant);
            return this;
        }

        public Builder relation(Relation relation) {
            relations.add(relation);
            return this;
        }

        public Builder relations(List<Relation> relations) {
            this.relations.clear();
            this.relations.addAll(relations);
            return this;
        }

        public Builder etymology(Etymology etymology) {
            etymologies.add(etymology);
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

        public Builder extension(ExtensionElement extension) {
            extensions.add(extension);
            return this;
        }

        public Entry build() {
            return new Entry(id, guid, order, dateCreated, dateModified, dateDeleted, lexicalUnit, citationForm,
                    grammaticalInfo, pronunciations, senses, variants, relations, etymologies, notes, fields, traits,
                    annotations, extensions);
        }
    }
}
