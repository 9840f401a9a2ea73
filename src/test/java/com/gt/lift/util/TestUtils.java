package com.gt.lift.util;

import com.gt.lift.model.Entry;
import com.gt.lift.model.GrammaticalInfo;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.Relation;
import com.gt.lift.model.Sense;
import com.gt.lift.model.Trait;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class TestUtils {

    public static final String SAMPLE_LIFT = "/lift/sample.lift";
    public static final String SAMPLE_RANGES = "/lift/sample.lift-ranges";

    public static byte[] readResource(String path) {
        try (InputStream in = TestUtils.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + path);
            }
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String readResourceAsString(String path) {
        return new String(readResource(path), StandardCharsets.UTF_8);
    }

    // Wraps entry markup in a bare <lift> root
    public static String liftDocument(String entries) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><lift version=\"0.13\">" + entries + "</lift>";
    }

    public static Entry getTestEntry() {
        return Entry.builder("test_entry")
                .lexicalUnit(Multitext.of("en", "test"))
                .relation(new Relation("synonym", "test_ref", List.of(new Trait("variant-type", "informal"))))
                .build();
    }

    public static Entry getNounEntry(String id, String headword) {
        return Entry.builder(id)
                .lexicalUnit(Multitext.of("seh", headword))
                .sense(Sense.builder(id + "_s1")
                        .grammaticalInfo(new GrammaticalInfo("Noun"))
                        .gloss(Multitext.of("en", headword + " gloss"))
                        .build())
                .build();
    }
}
