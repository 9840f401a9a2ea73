package com.gt.lift.ranges;

import com.gt.lift.exception.LiftParseException;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.Range;
import com.gt.lift.model.RangeElement;
import com.gt.lift.model.Trait;
import com.gt.lift.parser.IssueType;
import com.gt.lift.parser.ParseErrorType;
import com.gt.lift.parser.ParseMode;
import com.gt.lift.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LiftRangesParserTests {

    private LiftRangesParser liftRangesParser;

    @BeforeEach
    public void setup() {
        liftRangesParser = new LiftRangesParser();
    }

    @Test
    public void testParseSample() throws LiftParseException {
        RangesParseResult result = liftRangesParser.parse(TestUtils.readResource(TestUtils.SAMPLE_RANGES));
        RangesRegistry registry = result.registry();

        assertTrue(result.issues().isEmpty());
        assertEquals(List.of("grammatical-info", "semantic-domain-ddp4", "lexical-relation", "variant-type", "morph-type"),
                List.copyOf(registry.rangeIds()));

        Range grammaticalInfo = registry.range("grammatical-info").orElseThrow();
        assertEquals("d7f713e4-e8cf-11d3-9764-00c04f186933", grammaticalInfo.guid());
        assertEquals(Multitext.of("en", "Parts of speech"), grammaticalInfo.label());
        assertEquals(3, grammaticalInfo.elements().size());

        RangeElement noun = registry.element("grammatical-info", "Noun").orElseThrow();
        assertEquals(Multitext.of("en", "n"), noun.abbrev());
        assertNull(noun.parent());

        RangeElement transitive = registry.element("grammatical-info", "Transitive verb").orElseThrow();
        assertEquals("Verb", transitive.parent());
        assertEquals(List.of(new Trait("inflectable-feat", "transitivity")), transitive.traits());
    }

    @Test
    public void testNestedElementsFlattened() throws LiftParseException {
        RangesRegistry registry = liftRangesParser.parse(TestUtils.readResource(TestUtils.SAMPLE_RANGES)).registry();

        List<RangeElement> elements = registry.elements("semantic-domain-ddp4");
        assertEquals(List.of("1 Universe, creation", "1.1 Sky", "1.1.1 Sun", "6.5.1.1 House"),
                elements.stream().map(RangeElement::id).toList());

        assertNull(elements.get(0).parent());
        assertEquals("1 Universe, creation", elements.get(1).parent());
        assertEquals("1.1 Sky", elements.get(2).parent());
        assertNull(elements.get(3).parent());
        assertEquals(Multitext.of("en", "Sky"), elements.get(1).label());
    }

    @Test
    public void testExplicitParentWinsOverNesting() throws LiftParseException {
        String xml = "<lift-ranges><range id=\"r\">"
                + "<range-element id=\"a\"/>"
                + "<range-element id=\"b\"><range-element id=\"c\" parent=\"a\"/></range-element>"
                + "</range></lift-ranges>";

        RangesRegistry registry = liftRangesParser.parse(xml).registry();

        assertEquals("a", registry.element("r", "c").orElseThrow().parent());
    }

    @Test
    public void testDuplicateRangeKeepsFirst() throws LiftParseException {
        String xml = "<lift-ranges>"
                + "<range id=\"dialect\"><range-element id=\"north\"/></range>"
                + "<range id=\"dialect\"><range-element id=\"south\"/></range>"
                + "</lift-ranges>";

        RangesRegistry registry = liftRangesParser.parse(xml).registry();

        assertEquals(1, registry.ranges().size());
        assertTrue(registry.contains("dialect", "north"));
        assertFalse(registry.contains("dialect", "south"));
    }

    @Test
    public void testMissingIdStrict() {
        String xml = "<lift-ranges><range id=\"dialect\"><range-element/></range></lift-ranges>";

        LiftParseException ex = assertThrows(LiftParseException.class, () -> liftRangesParser.parse(xml));

        assertEquals(ParseErrorType.SCHEMA_VIOLATION, ex.getErrorType());
    }

    @Test
    public void testMissingIdLenient() throws LiftParseException {
        String xml = "<lift-ranges>"
                + "<range><range-element id=\"lost\"/></range>"
                + "<range id=\"dialect\"><range-element/><range-element id=\"north\"/></range>"
                + "</lift-ranges>";

        RangesParseResult result = new LiftRangesParser(ParseMode.LENIENT).parse(xml);

        assertEquals(List.of("dialect"), List.copyOf(result.registry().rangeIds()));
        assertEquals(List.of("north"), result.registry().elements("dialect").stream().map(RangeElement::id).toList());
        assertEquals(2, result.issues().size());
        assertTrue(result.issues().stream().allMatch(issue -> issue.type() == IssueType.SCHEMA_VIOLATION));
    }

    @Test
    public void testRangesInsideLiftHeader() throws LiftParseException {
        String xml = "<lift version=\"0.13\"><header><ranges>"
                + "<range id=\"dialect\"><range-element id=\"north\"/></range>"
                + "</ranges></header></lift>";

        RangesRegistry registry = liftRangesParser.parse(xml).registry();

        assertTrue(registry.contains("dialect", "north"));
    }

    @Test
    public void testMalformedInput() {
        LiftParseException ex = assertThrows(LiftParseException.class,
                () -> liftRangesParser.parse("<lift-ranges><range id=\"x\"></lift-ranges>"));
        assertEquals(ParseErrorType.MALFORMED_XML, ex.getErrorType());

        assertThrows(LiftParseException.class, () -> liftRangesParser.parse("  "));
        assertThrows(LiftParseException.class, () -> liftRangesParser.parse("just text"));
    }

    @Test
    public void testWrongRoot() {
        LiftParseException ex = assertThrows(LiftParseException.class,
                () -> liftRangesParser.parse("<html><body><range id=\"x\"/></body></html>"));

        assertEquals(ParseErrorType.SCHEMA_VIOLATION, ex.getErrorType());
        assertEquals("/html", ex.getPath());
    }

    @Test
    public void testGeneratedRangesReparse() throws Exception {
        RangesRegistry registry = liftRangesParser.parse(TestUtils.readResource(TestUtils.SAMPLE_RANGES)).registry();
        LiftRangesGenerator generator = new LiftRangesGenerator(true);

        String xml = generator.generate(registry);
        RangesRegistry reparsed = liftRangesParser.parse(new ByteArrayInputStream(generator.generateBytes(registry))).registry();

        assertTrue(xml.contains("<range-element id=\"1.1 Sky\" parent=\"1 Universe, creation\">"));
        assertEquals(registry.ranges(), reparsed.ranges());
    }
}
