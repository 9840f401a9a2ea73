package com.gt.lift.model;

import java.util.List;

/**
 * Common view over the two variant shapes LIFT carries: inline {@link Variant} allomorphs and
 * {@link Relation}s to other entries that carry a {@code variant-type} trait. Only used where
 * both need to be listed together; the shapes keep their own traits and serialize differently.
 */
public interface VariantLike {

    VariantKind kind();

    List<Trait> traits();

    // Target entry id, or null for an inline variant without a ref
    String ref();
}
