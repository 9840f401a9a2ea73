package com.gt.lift.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EntryTests {

    private static final Relation COMPONENT_RELATION = new Relation(Relation.COMPONENT_LEXEME_TYPE, "mu_1",
            List.of(new Trait(Relation.COMPLEX_FORM_TYPE_TRAIT, "Compound")));
    private static final Relation VARIANT_RELATION = new Relation("synonym", "test_ref",
            List.of(new Trait(Relation.VARIANT_TYPE_TRAIT, "informal")));
    private static final Variant DIRECT_VARIANT = Variant.builder()
            .form(Multitext.of("seh", "-ndi"))
            .trait(Variant.MORPH_TYPE_TRAIT, "suffix")
            .build();

    @Test
    public void testAllVariants() {
        Entry entry = Entry.builder("nyumba")
                .variant(DIRECT_VARIANT)
                .relation(COMPONENT_RELATION)
                .relation(VARIANT_RELATION)
                .build();

        List<VariantLike> variants = entry.allVariants();

        assertEquals(2, variants.size());
        assertEquals(VariantKind.DIRECT, variants.get(0).kind());
        assertEquals("suffix", ((Variant) variants.get(0)).morphType());
        assertEquals(VariantKind.RELATION, variants.get(1).kind());
        assertEquals("test_ref", variants.get(1).ref());
        assertEquals(List.of(new Trait(Relation.VARIANT_TYPE_TRAIT, "informal")), variants.get(1).traits());
    }

    @Test
    public void testRelationKinds() {
        assertTrue(COMPONENT_RELATION.isPrivateType());
        assertTrue(COMPONENT_RELATION.isComplexFormRelation());
        assertFalse(COMPONENT_RELATION.isVariantRelation());
        assertFalse(VARIANT_RELATION.isPrivateType());
        assertTrue(VARIANT_RELATION.isVariantRelation());
    }

    @Test
    public void testUnnamedTraits() {
        List<Trait> traits = List.of(new Trait(null, "v"), new Trait("dialect", "north"));
        Relation unnamed = new Relation("synonym", "x", List.of(new Trait(null, "v")));
        Entry entry = Entry.builder("a").relation(unnamed).build();

        assertEquals("north", Trait.find(traits, "dialect").orElseThrow());
        assertEquals(List.of("north"), Trait.findAll(traits, "dialect"));
        assertFalse(unnamed.isVariantRelation());
        assertFalse(unnamed.isComplexFormRelation());
        assertTrue(entry.allVariants().isEmpty());
    }

    @Test
    public void testHeadword() {
        Entry lexicalUnitOnly = Entry.builder("a").lexicalUnit(Multitext.of("seh", "nyumba")).build();
        Entry withCitation = lexicalUnitOnly.toBuilder().citationForm(Multitext.of("seh", "nyúmba")).build();

        assertEquals("nyumba", lexicalUnitOnly.headword());
        assertEquals("nyúmba", withCitation.headword());
        assertEquals("", Entry.builder("b").build().headword());
    }

    @Test
    public void testFindSense_Nested() {
        Sense subsense = Sense.builder("s1_1").gloss(Multitext.of("en", "household")).build();
        Entry entry = Entry.builder("nyumba")
                .sense(Sense.builder("s1").subsense(subsense).build())
                .build();

        assertEquals(subsense, entry.findSense("s1_1").orElseThrow());
        assertTrue(entry.findSense("missing").isEmpty());
    }

    @Test
    public void testCollectionsAreCopied() {
        List<Trait> traits = new ArrayList<>(List.of(new Trait("dialect", "north")));
        Field field = new Field("comment", null, traits);
        traits.add(new Trait("dialect", "south"));

        assertEquals(1, field.traits().size());
        assertSame(Multitext.EMPTY, field.content());
        assertThrows(UnsupportedOperationException.class, () -> field.traits().add(new Trait("x", "y")));
    }

    @Test
    public void testNullCollectionsBecomeEmpty() {
        Entry entry = new Entry("a", null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);

        assertTrue(entry.senses().isEmpty());
        assertTrue(entry.extensions().isEmpty());
        assertSame(Multitext.EMPTY, entry.lexicalUnit());
        assertFalse(entry.isDeleted());
    }
}
