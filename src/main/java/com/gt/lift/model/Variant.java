package com.gt.lift.model;

import java.util.ArrayList;
import java.util.List;

// Inline allomorph of an entry. Direct traits (e.g. morph-type) stay separate from grammatical-info traits.
public record Variant(String ref,
                      Multitext form,
                      List<Trait> traits,
                      GrammaticalInfo grammaticalInfo,
                      List<Pronunciation> pronunciations,
                      List<Relation> relations,
                      List<Field> fields,
                      List<ExtensionElement> extensions) implements VariantLike {

    public static final String MORPH_TYPE_TRAIT = "morph-type";

    public Variant {
        form = Models.textOf(form);
        traits = Models.listOf(traits);
        pronunciations = Models.listOf(pronunciations);
        relations = Models.listOf(relations);
        fields = Models.listOf(fields);
        extensions = Models.listOf(extensions);
    }

    public Variant(Multitext form, List<Trait> traits) {
        this(null, form, traits, null, List.of(), List.of(), List.of(), List.of());
    }

    @Override
    public VariantKind kind() {
        return VariantKind.DIRECT;
    }

    public String morphType() {
        return Trait.find(traits, MORPH_TYPE_TRAIT).orElse(null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.ref = ref;
        builder.form = form;
        builder.traits.addAll(traits);
        builder.grammaticalInfo = grammaticalInfo;
        builder.pronunciations.addAll(pronunciations);
        builder.relations.addAll(relations);
        builder.fields.addAll(fields);
        builder.extensions.addAll(extensions);
        return builder;
    }

    public static class Builder {
        private String ref;
        private Multitext form = Multitext.EMPTY;
        private final List<Trait> traits = new ArrayList<>();
        private GrammaticalInfo grammaticalInfo;
        private final List<Pronunciation> pronunciations = new ArrayList<>();
        private final List<Relation> relations = new ArrayList<>();
        private final List<Field> fields = new ArrayList<>();
        private final List<ExtensionElement> extensions = new ArrayList<>();

        private Builder() { }

        public Builder ref(String ref) {
            this.ref = ref;
            return this;
        }

        public Builder form(Multitext form) {
            this.form = form;
            return this;
        }

        public Builder trait(Trait trait) {
            traits.add(trait);
            return this;
        }

        public Builder trait(String name, String value) {
            return trait(new Trait(name, value));
        }

        public Builder grammaticalInfo(GrammaticalInfo grammaticalInfo) {
            this.grammaticalInfo = grammaticalInfo;
            return this;
        }

        public Builder pronunciation(Pronunciation pronunciation) {
            pronunciations.add(pronunciation);
            return this;
        }

        public Builder relation(Relation relation) {
            relations.add(relation);
            return this;
        }

        public Builder field(Field field) {
            fields.add(field);
            return this;
        }

        public Builder extension(ExtensionElement extension) {
            extensions.add(extension);
            return this;
        }

        public Variant build() {
            return new Variant(ref, form, traits, grammaticalInfo, pronunciations, relations, fields, extensions);
        }
    }
}
