package com.gt.lift.ranges;

import com.gt.lift.exception.LiftParseException;
import com.gt.lift.model.Range;
import com.gt.lift.model.RangeElement;
import com.gt.lift.model.Trait;
import com.gt.lift.parser.ParseErrorType;
import com.gt.lift.parser.ParseMode;
import com.gt.lift.parser.ParseSession;
import com.gt.lift.parser.PreservationMode;
import com.gt.lift.xml.LiftXml;
import com.gt.lift.xml.LiftXmlReader;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.filter.Filters;
import org.jdom2.input.JDOMParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code .lift-ranges} documents, or the ranges embedded in a LIFT header, into a {@link RangesRegistry}.
 * Nested {@code <range-element>}s are flattened, with the enclosing element as parent unless the nested
 * element names its own.
 */
public class LiftRangesParser {

    private static final Logger log = LoggerFactory.getLogger(LiftRangesParser.class);

    private static final String ROOT = "lift-ranges";
    private static final String LIFT_ROOT = "lift";
    private static final Set<String> FRAGMENT_ELEMENTS = Set.of("range");

    private final ParseMode parseMode;

    public LiftRangesParser() {
        this(ParseMode.STRICT);
    }

    public LiftRangesParser(ParseMode parseMode) {
        this.parseMode = parseMode;
    }

    public RangesParseResult parse(String xml) throws LiftParseException {
        if (xml == null || xml.isBlank()) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML, "/", "Ranges document is empty");
        }

        ParseSession session = new ParseSession(parseMode, PreservationMode.KNOWN_SUBSET);
        LiftXmlReader.NormalizedInput input = LiftXmlReader.normalize(xml, ROOT, FRAGMENT_ELEMENTS);
        if (input.namespaceDeclared()) {
            session.unresolvedNamespace("/" + ROOT,
                    "Prefix '" + LiftXml.LIFT_PREFIX + "' was not declared; bound to " + LiftXml.LIFT_NAMESPACE_URI);
        }

        Element root;
        try {
            root = LiftXmlReader.read(input.xml()).getRootElement();
        } catch (JDOMParseException ex) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML,
                    "line " + ex.getLineNumber() + ", column " + ex.getColumnNumber(), ex.getMessage(), ex);
        } catch (JDOMException | IOException ex) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML, "/", ex.getMessage(), ex);
        }
        if (input.wrapped() && !root.getTextTrim().isEmpty()) {
            throw new LiftParseException(ParseErrorType.MALFORMED_XML, "/", "Input has text outside of any element");
        }
        // A LIFT document may carry its ranges inline in the header
        if (!LiftXml.isNamed(root, ROOT) && !LiftXml.isNamed(root, LIFT_ROOT)) {
            throw new LiftParseException(ParseErrorType.SCHEMA_VIOLATION, LiftXml.path(root),
                    "Root element <" + root.getName() + "> is not a LIFT ranges document");
        }

        List<Range> ranges = new ArrayList<>();
        Set<String> rangeIds = new HashSet<>();
        for (Element rangeElement : findRanges(root)) {
            Range range = readRange(rangeElement, session);
            if (range == null) {
                continue;
            }
            if (rangeIds.add(range.id())) {
                ranges.add(range);
            } else {
                log.warn("Ignoring duplicate range {}", range.id());
            }
        }

        log.info("Parsed {} LIFT ranges with {} issues", ranges.size(), session.getIssues().size());
        return new RangesParseResult(new RangesRegistry(ranges), session.getIssues());
    }

    public RangesParseResult parse(byte[] xml) throws LiftParseException {
        return parse(LiftXmlReader.decode(xml));
    }

    public RangesParseResult parse(InputStream in) throws LiftParseException, IOException {
        return parse(in.readAllBytes());
    }

    private List<Element> findRanges(Element root) {
        List<Element> ranges = new ArrayList<>();
        for (Element element : root.getDescendants(Filters.element())) {
            if (LiftXml.isNamed(element, "range")) {
                ranges.add(element);
            }
        }
        return ranges;
    }

    private Range readRange(Element element, ParseSession session) throws LiftParseException {
        String id = LiftXml.attribute(element, "id");
        if (id == null || id.isBlank()) {
            session.schemaViolation(element, "range has no id");
            return null;
        }

        List<RangeElement> elements = new ArrayList<>();
        readRangeElements(element, null, elements, session);
        return new Range(id,
                LiftXml.attribute(element, "guid"),
                LiftXml.attribute(element, "href"),
                LiftXml.multitext(LiftXml.children(element, "label")),
                LiftXml.multitext(LiftXml.children(element, "description")),
                LiftXml.multitext(LiftXml.children(element, "abbrev")),
                elements);
    }

    private void readRangeElements(Element container, String enclosingId, List<RangeElement> out,
                                   ParseSession session) throws LiftParseException {
        for (Element child : LiftXml.children(container, "range-element")) {
            RangeElement element = readRangeElement(child, enclosingId, session);
            if (element != null) {
                out.add(element);
            }
            readRangeElements(child, element != null ? element.id() : enclosingId, out, session);
        }
    }

    private RangeElement readRangeElement(Element element, String enclosingId, ParseSession session)
            throws LiftParseException {
        String id = LiftXml.attribute(element, "id");
        if (id == null || id.isBlank()) {
            session.schemaViolation(element, "range-element has no id");
            return null;
        }

        String parent = LiftXml.attribute(element, "parent");
        if (parent == null || parent.isBlank()) {
            parent = enclosingId;
        }

        List<Trait> traits = new ArrayList<>();
        for (Element trait : LiftXml.children(element, "trait")) {
            String name = LiftXml.attribute(trait, "name");
            String value = LiftXml.attribute(trait, "value");
            if (name == null || name.isBlank() || value == null) {
                session.schemaViolation(trait, "trait needs both name and value");
                continue;
            }
            traits.add(new Trait(name, value));
        }

        return new RangeElement(id,
                LiftXml.attribute(element, "guid"),
                parent,
                LiftXml.multitext(LiftXml.children(element, "label")),
                LiftXml.multitext(LiftXml.children(element, "description")),
                LiftXml.multitext(LiftXml.children(element, "abbrev")),
                traits);
    }
}
