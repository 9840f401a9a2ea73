package com.gt.lift.generator;

import com.gt.lift.exception.InvalidLiftModelException;
import com.gt.lift.model.ExtensionElement;
import com.gt.lift.model.FieldDeclaration;
import com.gt.lift.model.LiftHeader;
import com.gt.lift.model.RangeReference;
import com.gt.lift.xml.LiftExtensions;
import com.gt.lift.xml.LiftXml;
import org.jdom2.Element;

public class HeaderGenerator {

    // Returns null for an empty header, which is then left out of the document
    public Element generate(LiftHeader header) {
        if (header == null || header.isEmpty()) {
            return null;
        }

        Element element = LiftXml.element("header");
        LiftXml.addIfPresent(element, LiftXml.multitextElement("description", header.description()));

        if (header.rangesHref() != null || !header.rangeReferences().isEmpty()) {
            Element ranges = LiftXml.element("ranges");
            LiftXml.setAttribute(ranges, "href", header.rangesHref());
            for (RangeReference reference : header.rangeReferences()) {
                if (reference.id() == null || reference.id().isBlank()) {
                    throw new InvalidLiftModelException("Header range reference has no id");
                }
                Element range = LiftXml.element("range");
                range.setAttribute("id", reference.id());
                LiftXml.setAttribute(range, "href", reference.href());
                ranges.addContent(range);
            }
            element.addContent(ranges);
        }

        if (!header.fieldDeclarations().isEmpty()) {
            Element fields = LiftXml.element("fields");
            for (FieldDeclaration declaration : header.fieldDeclarations()) {
                if (declaration.type() == null || declaration.type().isBlank()) {
                    throw new InvalidLiftModelException("Header field declaration has no type");
                }
                Element field = LiftXml.element("field");
                field.setAttribute("tag", declaration.type());
                LiftXml.addForms(field, declaration.description());
                fields.addContent(field);
            }
            element.addContent(fields);
        }

        for (ExtensionElement extension : header.extensions()) {
            element.addContent(LiftExtensions.restore(extension));
        }
        return element;
    }
}
