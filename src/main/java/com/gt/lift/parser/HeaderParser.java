package com.gt.lift.parser;

import com.gt.lift.exception.LiftParseException;
import com.gt.lift.model.FieldDeclaration;
import com.gt.lift.model.LiftHeader;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.RangeReference;
import com.gt.lift.xml.LiftXml;
import org.jdom2.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads the {@code <header>} block. The header is independent of the entries, so a missing or empty header
 * never affects how entries parse.
 */
public class HeaderParser {

    private static final Set<String> HEADER_CHILDREN = Set.of("description", "ranges", "fields");

    public LiftHeader parse(Element header, ParseSession session) throws LiftParseException {
        if (header == null) {
            return LiftHeader.EMPTY;
        }

        Multitext description = LiftXml.multitext(LiftXml.children(header, "description"));

        String rangesHref = null;
        List<RangeReference> rangeReferences = new ArrayList<>();
        Element ranges = LiftXml.child(header, "ranges");
        if (ranges != null) {
            String href = LiftXml.attribute(ranges, "href");
            rangesHref = href == null || href.isBlank() ? null : href;
            for (Element range : LiftXml.children(ranges, "range")) {
                RangeReference reference = parseRangeReference(range, session);
                if (reference != null) {
                    rangeReferences.add(reference);
                }
            }
        }

        List<FieldDeclaration> fieldDeclarations = new ArrayList<>();
        for (Element fields : LiftXml.children(header, "fields")) {
            for (Element field : LiftXml.children(fields, "field")) {
                FieldDeclaration declaration = parseFieldDeclaration(field, session);
                if (declaration != null) {
                    fieldDeclarations.add(declaration);
                }
            }
        }

        return new LiftHeader(description, rangesHref, rangeReferences, fieldDeclarations,
                session.unknownChildren(header, HEADER_CHILDREN, true));
    }

    private RangeReference parseRangeReference(Element range, ParseSession session) throws LiftParseException {
        String id = LiftXml.attribute(range, "id");
        if (id == null || id.isBlank()) {
            session.schemaViolation(range, "range reference has no id");
            return null;
        }
        return new RangeReference(id, LiftXml.attribute(range, "href"));
    }

    // LIFT 0.13 names the declared field with "tag"; some producers write "type"
    private FieldDeclaration parseFieldDeclaration(Element field, ParseSession session) throws LiftParseException {
        String type = LiftXml.attribute(field, "tag");
        if (type == null || type.isBlank()) {
            type = LiftXml.attribute(field, "type");
        }
        if (type == null || type.isBlank()) {
            session.schemaViolation(field, "field declaration has no tag");
            return null;
        }
        return new FieldDeclaration(type, LiftXml.multitext(field));
    }
}
