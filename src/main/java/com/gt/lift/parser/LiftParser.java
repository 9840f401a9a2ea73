package com.gt.lift.parser;

import com.gt.lift.exception.LiftParseException;
import com.gt.lift.model.Annotation;
import com.gt.lift.model.Entry;
import com.gt.lift.model.Etymology;
import com.gt.lift.model.Example;
import com.gt.lift.model.Field;
import com.gt.lift.model.GrammaticalInfo;
import com.gt.lift.model.LiftDocument;
import com.gt.lift.model.LiftHeader;
import com.gt.lift.model.Media;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.Note;
import com.gt.lift.model.Pronunciation;
import com.gt.lift.model.Relation;
import com.gt.lift.model.Sense;
import com.gt.lift.model.Trait;
import com.gt.lift.model.Translation;
import com.gt.lift.model.Variant;
import com.gt.lift.xml.LiftXml;
import com.gt.lift.xml.LiftXmlReader;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.JDOMParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reads LIFT XML into a {@link LiftDocument}. Instances hold configuration only and can be shared between
 * threads; everything a single call accumulates lives in its {@link ParseSession}.
 */
public class LiftParser {

    private static final Logger log = LoggerFactory.getLogger(LiftParser.class);

    public static final int DEFAULT_MAX_SENSE_DEPTH = 8;

    private static final String ROOT = "lift";

    private static final Set<String> ROOT_CHILDREN = Set.of("header", "entry");
    // Top-level elements accepted without a <lift> root
    private static final Set<String> FRAGMENT_ELEMENTS = Set.of("header", "entry");
    private static final Set<String> ENTRY_CHILDREN = Set.of("lexical-unit", "citation", "pronunciation", "sense",
            "variant", "relation", "etymology", "field", "note", "grammatical-info", "trait", "annotation");
    private static final Set<String> SENSE_CHILDREN = Set.of("grammatical-info", "gloss", "definition", "relation",
            "note", "example", "field", "trait", "annotation", "subsense", "sense");
    private static final Set<String> VARIANT_CHILDREN = Set.of("form", "pronunciation", "grammatical-info",
            "relation", "field", "trait");
    private static final Set<String> PRONUNCIATION_CHILDREN = Set.of("form", "media", "field", "trait");
    private static final Set<String> EXAMPLE_CHILDREN = Set.of("form", "translation", "note", "field", "trait");
    private static final Set<String> FORM_OWNER_CHILDREN = Set.of("form");
    private static final Set<String> TRAIT_OWNER_CHILDREN = Set.of("trait");
    private static final Set<String> FIELD_CHILDREN = Set.of("form", "trait");
    private static final Set<String> ETYMOLOGY_CHILDREN = Set.of("form", "gloss", "field", "trait");

    private final ParseMode parseMode;
    private final PreservationMode preservationMode;
    private final int maxSenseDepth;
    private final HeaderParser headerParser = new HeaderParser();

    public LiftParser() {
        this(ParseMode.STRICT, PreservationMode.KNOWN_SUBSET, DEFAULT_MAX_SENSE_DEPTH);
    }

    public LiftParser(ParseMode parseMode, PreservationMode preservationMode, int maxSenseDepth) {
        if (maxSenseDepth < 1) {
            throw new IllegalArgumentException("Maximum sense depth must be at least 1, was " + maxSenseDepth);
        }
        this.parseMode = parseMode;
        this.preservationMode = preservationMode;
        this.maxSenseDepth = maxSenseDepth;
    }

    public LiftParseResult parse(String xml) throws LiftParseException {
        if (xml == null || xml.isBlank()) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML, "/", "Document is empty");
        }

        long startTime = System.currentTimeMillis();
        ParseSession session = new ParseSession(parseMode, preservationMode);
        Element root = readRoot(xml, session);
        LiftDocument document = readDocument(root, session);

        log.info("Parsed {} LIFT entries in {} ms with {} issues",
                document.entries().size(), System.currentTimeMillis() - startTime, session.getIssues().size());
        return new LiftParseResult(document, session.getIssues(), LiftXml.attribute(root, "version"));
    }

    public LiftParseResult parse(byte[] xml) throws LiftParseException {
        return parse(LiftXmlReader.decode(xml));
    }

    public LiftParseResult parse(InputStream in) throws LiftParseException, IOException {
        return parse(in.readAllBytes());
    }

    /**
     * Parses a single {@code <entry>} fragment, as stored per entry in an XML database.
     */
    public Entry parseEntry(String entryXml) throws LiftParseException {
        List<Entry> entries = parse(entryXml).document().entries();
        if (entries.isEmpty()) {
            throw new LiftParseException(ParseErrorType.SCHEMA_VIOLATION, "/" + ROOT, "No entry found in fragment");
        }
        return entries.get(0);
    }

    private Element readRoot(String xml, ParseSession session) throws LiftParseException {
        LiftXmlReader.NormalizedInput input = LiftXmlReader.normalize(xml, ROOT, FRAGMENT_ELEMENTS);
        if (input.namespaceDeclared()) {
            session.unresolvedNamespace("/" + ROOT,
                    "Prefix '" + LiftXml.LIFT_PREFIX + "' was not declared; bound to " + LiftXml.LIFT_NAMESPACE_URI);
        }

        Document document;
        try {
            document = LiftXmlReader.read(input.xml());
        } catch (JDOMParseException ex) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML,
                    "line " + ex.getLineNumber() + ", column " + ex.getColumnNumber(), ex.getMessage(), ex);
        } catch (JDOMException | IOException ex) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML, "/", ex.getMessage(), ex);
        }

        Element root = document.getRootElement();
        if (input.wrapped() && !root.getTextTrim().isEmpty()) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML, "/", "Input has text outside of any element");
        }
        if (!LiftXml.isNamed(root, ROOT)) {
            throw new LiftParseException(ParseErrorType.SCHEMA_VIOLATION, LiftXml.path(root),
                    "Root element <" + root.getName() + "> is not a LIFT document");
        }
        return root;
    }

    private LiftDocument readDocument(Element root, ParseSession session) throws LiftParseException {
        LiftHeader header = headerParser.parse(LiftXml.child(root, "header"), session);

        List<Entry> entries = new ArrayList<>();
        for (Element entryElement : LiftXml.children(root, "entry")) {
            Entry entry = readEntry(entryElement, session);
            if (entry != null) {
                entries.add(entry);
            }
        }
        session.unknownChildren(root, ROOT_CHILDREN, false);

        return new LiftDocument(LiftXml.attribute(root, "producer"), header, entries);
    }

    private Entry readEntry(Element element, ParseSession session) throws LiftParseException {
        String id = LiftXml.attribute(element, "id");
        if (id == null || id.isBlank()) {
            session.schemaViolation(element, "entry has no id");
            return null;
        }

        Entry.Builder builder = Entry.builder(id)
                .guid(LiftXml.attribute(element, "guid"))
                .order(readOrder(element, session))
                .dateCreated(LiftXml.attribute(element, "dateCreated"))
                .dateModified(LiftXml.attribute(element, "dateModified"))
                .dateDeleted(LiftXml.attribute(element, "dateDeleted"))
                .lexicalUnit(LiftXml.multitext(LiftXml.children(element, "lexical-unit")))
                .citationForm(LiftXml.multitext(LiftXml.children(element, "citation")))
                .grammaticalInfo(readGrammaticalInfo(LiftXml.child(element, "grammatical-info"), session));

        for (Element child : LiftXml.children(element, "pronunciation")) {
            addIfPresent(readPronunciation(child, session), builder::pronunciation);
        }
        for (Element child : LiftXml.children(element, "sense")) {
            addIfPresent(readSense(child, 1, session), builder::sense);
        }
        for (Element child : LiftXml.children(element, "variant")) {
            addIfPresent(readVariant(child, session), builder::variant);
        }
        for (Element child : LiftXml.children(element, "relation")) {
            addIfPresent(readRelation(child, session), builder::relation);
        }
        for (Element child : LiftXml.children(element, "etymology")) {
            addIfPresent(readEtymology(child, session), builder::etymology);
        }
        readFields(element, session).forEach(builder::field);
        for (Element child : LiftXml.children(element, "note")) {
            builder.note(readNote(child, session));
        }
        readTraits(element, session).forEach(builder::trait);
        for (Element child : LiftXml.children(element, "annotation")) {
            addIfPresent(readAnnotation(child, session), builder::annotation);
        }
        session.unknownChildren(element, ENTRY_CHILDREN, true).forEach(builder::extension);

        return builder.build();
    }

    private Sense readSense(Element element, int depth, ParseSession session) throws LiftParseException {
        if (depth > maxSenseDepth) {
            session.schemaViolation(element, "sense nesting exceeds " + maxSenseDepth + " levels");
            return null;
        }

        Sense.Builder builder = Sense.builder(LiftXml.attribute(element, "id"))
                .order(readOrder(element, session))
                .grammaticalInfo(readGrammaticalInfo(LiftXml.child(element, "grammatical-info"), session))
                .gloss(LiftXml.multitext(LiftXml.children(element, "gloss")))
                .definition(LiftXml.multitext(LiftXml.children(element, "definition")));

        for (Element child : LiftXml.children(element, "relation")) {
            addIfPresent(readRelation(child, session), builder::relation);
        }
        for (Element child : LiftXml.children(element, "note")) {
            builder.note(readNote(child, session));
        }
        for (Element child : LiftXml.children(element, "example")) {
            builder.example(readExample(child, session));
        }
        readFields(element, session).forEach(builder::field);
        readTraits(element, session).forEach(builder::trait);
        for (Element child : LiftXml.children(element, "annotation")) {
            addIfPresent(readAnnotation(child, session), builder::annotation);
        }

        // <subsense> is the LIFT form; a nested <sense> is accepted as well, in document order
        for (Element child : element.getChildren()) {
            if (LiftXml.isNamed(child, "subsense") || LiftXml.isNamed(child, "sense")) {
                addIfPresent(readSense(child, depth + 1, session), builder::subsense);
            }
        }
        session.unknownChildren(element, SENSE_CHILDREN, true).forEach(builder::extension);

        return builder.build();
    }

    private Variant readVariant(Element element, ParseSession session) throws LiftParseException {
        Variant.Builder builder = Variant.builder()
                .ref(LiftXml.attribute(element, "ref"))
                .form(LiftXml.multitext(element))
                .grammaticalInfo(readGrammaticalInfo(LiftXml.child(element, "grammatical-info"), session));

        for (Element child : LiftXml.children(element, "pronunciation")) {
            addIfPresent(readPronunciation(child, session), builder::pronunciation);
        }
        for (Element child : LiftXml.children(element, "relation")) {
            addIfPresent(readRelation(child, session), builder::relation);
        }
        readFields(element, session).forEach(builder::field);
        // Only direct children: grammatical-info traits stay with the grammatical info
        readTraits(element, session).forEach(builder::trait);
        session.unknownChildren(element, VARIANT_CHILDREN, true).forEach(builder::extension);

        return builder.build();
    }

    private Pronunciation readPronunciation(Element element, ParseSession session) throws LiftParseException {
        Pronunciation.Builder builder = Pronunciation.builder().form(LiftXml.multitext(element));

        for (Element child : LiftXml.children(element, "media")) {
            addIfPresent(readMedia(child, session), builder::media);
        }
        readFields(element, session).forEach(builder::field);
        readTraits(element, session).forEach(builder::trait);
        session.unknownChildren(element, PRONUNCIATION_CHILDREN, true).forEach(builder::extension);

        return builder.build();
    }

    private Media readMedia(Element element, ParseSession session) throws LiftParseException {
        String href = LiftXml.attribute(element, "href");
        if (href == null || href.isBlank()) {
            session.schemaViolation(element, "media has no href");
            return null;
        }
        session.unknownChildren(element, Set.of("label"), false);
        return new Media(href, LiftXml.multitext(LiftXml.child(element, "label")));
    }

    private Example readExample(Element element, ParseSession session) throws LiftParseException {
        Example.Builder builder = Example.builder()
                .source(LiftXml.attribute(element, "source"))
                .form(LiftXml.multitext(element));

        for (Element child : LiftXml.children(element, "translation")) {
            session.unknownChildren(child, FORM_OWNER_CHILDREN, false);
            builder.translation(new Translation(LiftXml.attribute(child, "type"), LiftXml.multitext(child)));
        }
        for (Element child : LiftXml.children(element, "note")) {
            builder.note(readNote(child, session));
        }
        readFields(element, session).forEach(builder::field);
        readTraits(element, session).forEach(builder::trait);
        session.unknownChildren(element, EXAMPLE_CHILDREN, true).forEach(builder::extension);

        return builder.build();
    }

    private Relation readRelation(Element element, ParseSession session) throws LiftParseException {
        String type = LiftXml.attribute(element, "type");
        if (type == null || type.isBlank()) {
            session.schemaViolation(element, "relation has no type");
            return null;
        }
        String ref = LiftXml.attribute(element, "ref");
        if (ref == null || ref.isBlank()) {
            session.schemaViolation(element, "relation has no ref");
            return null;
        }

        Integer order = readOrder(element, session);
        List<Trait> traits = readTraits(element, session);
        session.unknownChildren(element, TRAIT_OWNER_CHILDREN, false);
        return new Relation(type, ref, order, traits);
    }

    private Etymology readEtymology(Element element, ParseSession session) throws LiftParseException {
        List<Field> fields = readFields(element, session);
        List<Trait> traits = readTraits(element, session);
        session.unknownChildren(element, ETYMOLOGY_CHILDREN, false);
        return new Etymology(LiftXml.attribute(element, "type"), LiftXml.attribute(element, "source"),
                LiftXml.multitext(element), LiftXml.multitext(LiftXml.children(element, "gloss")), fields, traits);
    }

    private GrammaticalInfo readGrammaticalInfo(Element element, ParseSession session) throws LiftParseException {
        if (element == null) {
            return null;
        }
        String value = LiftXml.attribute(element, "value");
        if (value == null || value.isBlank()) {
            session.schemaViolation(element, "grammatical-info has no value");
            return null;
        }
        List<Trait> traits = readTraits(element, session);
        session.unknownChildren(element, TRAIT_OWNER_CHILDREN, false);
        return new GrammaticalInfo(value, traits);
    }

    private List<Field> readFields(Element owner, ParseSession session) throws LiftParseException {
        List<Field> fields = new ArrayList<>();
        for (Element element : LiftXml.children(owner, "field")) {
            String type = LiftXml.attribute(element, "type");
            if (type == null || type.isBlank()) {
                session.schemaViolation(element, "field has no type");
                continue;
            }
            List<Trait> traits = readTraits(element, session);
            session.unknownChildren(element, FIELD_CHILDREN, false);
            fields.add(new Field(type, LiftXml.multitext(element), traits));
        }
        return fields;
    }

    private List<Trait> readTraits(Element owner, ParseSession session) throws LiftParseException {
        List<Trait> traits = new ArrayList<>();
        for (Element element : LiftXml.children(owner, "trait")) {
            String name = LiftXml.attribute(element, "name");
            String value = LiftXml.attribute(element, "value");
            if (name == null || name.isBlank() || value == null) {
                session.schemaViolation(element, "trait needs both name and value");
                continue;
            }
            traits.add(new Trait(name, value));
        }
        return traits;
    }

    // A plain-text note without forms is read as undetermined-language text
    private Note readNote(Element element, ParseSession session) {
        Multitext content = LiftXml.multitext(element);
        if (content.isEmpty() && !element.getTextTrim().isEmpty()) {
            content = Multitext.of(LiftXml.UNDETERMINED_LANGUAGE, element.getTextTrim());
        }
        session.unknownChildren(element, FORM_OWNER_CHILDREN, false);
        return new Note(LiftXml.attribute(element, "type"), content);
    }

    private Annotation readAnnotation(Element element, ParseSession session) throws LiftParseException {
        String name = LiftXml.attribute(element, "name");
        if (name == null || name.isBlank()) {
            session.schemaViolation(element, "annotation has no name");
            return null;
        }
        session.unknownChildren(element, FORM_OWNER_CHILDREN, false);
        return new Annotation(name, LiftXml.attribute(element, "value"), LiftXml.attribute(element, "who"),
                LiftXml.attribute(element, "when"), LiftXml.multitext(element));
    }

    private Integer readOrder(Element element, ParseSession session) throws LiftParseException {
        String order = LiftXml.attribute(element, "order");
        if (order == null || order.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(order.trim());
        } catch (NumberFormatException ex) {
            session.schemaViolation(element, "order '" + order + "' is not an integer");
            return null;
        }
    }

    private static <T> void addIfPresent(T value, Consumer<T> target) {
        if (value != null) {
            target.accept(value);
        }
    }
}
