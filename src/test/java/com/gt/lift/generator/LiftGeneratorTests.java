package com.gt.lift.generator;

import com.gt.lift.exception.InvalidLiftModelException;
import com.gt.lift.exception.LiftParseException;
import com.gt.lift.model.Entry;
import com.gt.lift.model.ExtensionElement;
import com.gt.lift.model.Field;
import com.gt.lift.model.FieldDeclaration;
import com.gt.lift.model.GrammaticalInfo;
import com.gt.lift.model.LiftDocument;
import com.gt.lift.model.LiftHeader;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.Relation;
import com.gt.lift.model.Sense;
import com.gt.lift.model.Trait;
import com.gt.lift.model.Variant;
import com.gt.lift.parser.LiftParser;
import com.gt.lift.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LiftGeneratorTests {

    private static final String PRODUCER = "lift-codec test";

    private LiftGenerator liftGenerator;
    private LiftParser liftParser;

    @BeforeEach
    public void setup() {
        liftGenerator = new LiftGenerator(PRODUCER, true);
        liftParser = new LiftParser();
    }

    @Test
    public void testGenerateTestEntry() throws LiftParseException {
        Entry entry = TestUtils.getTestEntry();

        String xml = liftGenerator.generate(new LiftDocument(LiftHeader.EMPTY, List.of(entry)));

        assertTrue(xml.contains("<relation type=\"synonym\" ref=\"test_ref\">"));
        assertTrue(xml.contains("<trait name=\"variant-type\" value=\"informal\""));
        assertTrue(xml.indexOf("<relation type=\"synonym\"") < xml.indexOf("<trait name=\"variant-type\""));
        assertEquals(entry, liftParser.parse(xml).document().entries().get(0));
    }

    @Test
    public void testRootAndDeclaration() {
        String xml = liftGenerator.generate(new LiftDocument(LiftHeader.EMPTY, List.of()));

        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));
        assertTrue(xml.contains("<lift "));
        assertTrue(xml.contains("xmlns=\"http://fieldworks.sil.org/schemas/lift/0.13\""));
        assertTrue(xml.contains("version=\"0.13\""));
        assertTrue(xml.contains("producer=\"" + PRODUCER + "\""));
        assertFalse(xml.contains("xmlns:lift"));
    }

    @Test
    public void testDocumentProducerWins() {
        String xml = liftGenerator.generate(new LiftDocument("FLEx", LiftHeader.EMPTY, List.of()));

        assertTrue(xml.contains("producer=\"FLEx\""));
        assertFalse(xml.contains(PRODUCER));
    }

    @Test
    public void testEmptyContainersOmitted() {
        Entry entry = Entry.builder("bare").lexicalUnit(Multitext.of("en", "bare")).build();

        String xml = liftGenerator.generate(new LiftDocument(LiftHeader.EMPTY, List.of(entry)));

        assertTrue(xml.contains("<lexical-unit>"));
        for (String absent : List.of("<header", "<citation", "<sense", "<variant", "<relation", "<note",
                "<field", "<trait", "<pronunciation", "<grammatical-info", "guid=", "dateCreated=")) {
            assertFalse(xml.contains(absent), absent);
        }
    }

    @Test
    public void testEntryChildOrder() {
        Entry entry = Entry.builder("order")
                .trait("dialect", "north")
                .field(new Field("comment", Multitext.of("en", "c")))
                .relation(new Relation("antonym", "other"))
                .variant(Variant.builder().form(Multitext.of("seh", "v")).build())
                .sense(Sense.builder("s").gloss(Multitext.of("en", "g")).build())
                .citationForm(Multitext.of("seh", "cit"))
                .lexicalUnit(Multitext.of("seh", "lu"))
                .build();

        String xml = liftGenerator.generateEntry(entry);

        List<String> expectedOrder = List.of("<lexical-unit", "<citation", "<sense", "<variant", "<relation",
                "<field", "<trait");
        for (int i = 1; i < expectedOrder.size(); i++) {
            assertTrue(xml.indexOf(expectedOrder.get(i - 1)) < xml.indexOf(expectedOrder.get(i)),
                    expectedOrder.get(i - 1) + " before " + expectedOrder.get(i));
        }
    }

    @Test
    public void testGlossShapeAndSubsense() {
        Sense sense = Sense.builder("s1")
                .grammaticalInfo(new GrammaticalInfo("Noun"))
                .gloss(Multitext.of("en", "house", "pt", "casa"))
                .subsense(Sense.builder("s1_1").gloss(Multitext.of("en", "household")).build())
                .build();

        String xml = liftGenerator.generateEntry(Entry.builder("a").sense(sense).build());

        assertTrue(xml.contains("<gloss lang=\"en\">"));
        assertTrue(xml.contains("<gloss lang=\"pt\">"));
        assertTrue(xml.contains("<subsense id=\"s1_1\">"));
        assertTrue(xml.indexOf("<grammatical-info") < xml.indexOf("<gloss"));
    }

    @Test
    public void testHeaderGenerated() {
        LiftHeader header = new LiftHeader(Multitext.of("en", "Test dictionary"), "test.lift-ranges",
                List.of(new FieldDeclaration("literal-meaning", Multitext.of("en", "Literal meaning"))));

        String xml = liftGenerator.generate(new LiftDocument(header, List.of()));

        assertTrue(xml.contains("<header>"));
        assertTrue(xml.contains("<ranges href=\"test.lift-ranges\""));
        assertTrue(xml.contains("<field tag=\"literal-meaning\">"));
    }

    @Test
    public void testTextEscaped() throws LiftParseException {
        Entry entry = Entry.builder("esc").lexicalUnit(Multitext.of("en", "fish & <chips>")).build();

        String xml = liftGenerator.generateEntry(entry);

        assertTrue(xml.contains("fish &amp; &lt;chips&gt;"));
        assertEquals(entry, liftParser.parseEntry(xml));
    }

    @Test
    public void testExtensionsWrittenLast() {
        Entry entry = Entry.builder("ext")
                .lexicalUnit(Multitext.of("en", "x"))
                .extension(new ExtensionElement("illustration", "<illustration href=\"x.jpg\" />"))
                .trait("dialect", "north")
                .build();

        String xml = liftGenerator.generateEntry(entry);

        assertTrue(xml.contains("<illustration href=\"x.jpg\""));
        assertTrue(xml.indexOf("<trait") < xml.indexOf("<illustration"));
    }

    @Test
    public void testPreconditions() {
        assertThrows(InvalidLiftModelException.class,
                () -> liftGenerator.generateEntry(Entry.builder(null).lexicalUnit(Multitext.of("en", "x")).build()));
        assertThrows(InvalidLiftModelException.class,
                () -> liftGenerator.generateEntry(Entry.builder("a").relation(new Relation("synonym", null)).build()));
        assertThrows(InvalidLiftModelException.class,
                () -> liftGenerator.generateEntry(Entry.builder("a").relation(new Relation(" ", "b")).build()));
        assertThrows(InvalidLiftModelException.class,
                () -> liftGenerator.generateEntry(Entry.builder("a").trait(new Trait("dialect", null)).build()));
        assertThrows(InvalidLiftModelException.class,
                () -> liftGenerator.generateEntry(Entry.builder("a").field(new Field(null, Multitext.of("en", "x"))).build()));
    }

    @Test
    public void testGenerateToStreamAndBytes() throws IOException {
        LiftDocument document = new LiftDocument(LiftHeader.EMPTY, List.of(TestUtils.getTestEntry()));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        liftGenerator.generate(document, out);

        assertEquals(liftGenerator.generate(document), out.toString(StandardCharsets.UTF_8));
        assertArrayEquals(out.toByteArray(), liftGenerator.generateBytes(document));
    }

    @Test
    public void testCompactOutput() {
        LiftGenerator compactGenerator = new LiftGenerator(PRODUCER, false);

        String xml = compactGenerator.generateEntry(TestUtils.getTestEntry());

        assertFalse(xml.contains("\n"));
    }
}
