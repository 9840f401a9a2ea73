package com.gt.lift.model;

import java.util.List;

public record Relation(String type, String ref, Integer order, List<Trait> traits) implements VariantLike {

    public static final String VARIANT_TYPE_TRAIT = "variant-type";
    public static final String COMPLEX_FORM_TYPE_TRAIT = "complex-form-type";
    public static final String COMPONENT_LEXEME_TYPE = "_component-lexeme";

    public Relation {
        traits = Models.listOf(traits);
    }

    public Relation(String type, String ref) {
        this(type, ref, null, List.of());
    }

    public Relation(String type, String ref, List<Trait> traits) {
        this(type, ref, null, traits);
    }

    @Override
    public VariantKind kind() {
        return VariantKind.RELATION;
    }

    public boolean isVariantRelation() {
        return traits.stream().anyMatch(trait -> VARIANT_TYPE_TRAIT.equals(trait.name()));
    }

    public boolean isComplexFormRelation() {
        return traits.stream().anyMatch(trait -> COMPLEX_FORM_TYPE_TRAIT.equals(trait.name()));
    }

    // Private relation types such as _component-lexeme are tool specific
    public boolean isPrivateType() {
        return type != null && type.startsWith("_");
    }

    public Relation withTraits(List<Trait> traits) {
        return new Relation(type, ref, order, traits);
    }
}
