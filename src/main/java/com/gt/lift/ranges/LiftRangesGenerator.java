package com.gt.lift.ranges;

import com.gt.lift.exception.InvalidLiftModelException;
import com.gt.lift.model.Range;
import com.gt.lift.model.RangeElement;
import com.gt.lift.model.Trait;
import com.gt.lift.xml.LiftXml;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.output.XMLOutputter;

import java.nio.charset.StandardCharsets;

// Writes a registry back out as a flat <lift-ranges> document; hierarchy is kept in parent attributes
public class LiftRangesGenerator {

    private final XMLOutputter outputter;

    public LiftRangesGenerator(boolean prettyPrint) {
        this.outputter = LiftXml.outputter(prettyPrint);
    }

    public String generate(RangesRegistry registry) {
        Element root = LiftXml.element("lift-ranges");
        for (Range range : registry.ranges()) {
            root.addContent(rangeElement(range));
        }
        return outputter.outputString(new Document(root));
    }

    public byte[] generateBytes(RangesRegistry registry) {
        return generate(registry).getBytes(StandardCharsets.UTF_8);
    }

    private Element rangeElement(Range range) {
        if (range.id() == null || range.id().isBlank()) {
            throw new InvalidLiftModelException("Range has no id");
        }

        Element element = LiftXml.element("range");
        element.setAttribute("id", range.id());
        LiftXml.setAttribute(element, "guid", range.guid());
        LiftXml.setAttribute(element, "href", range.href());
        LiftXml.addIfPresent(element, LiftXml.multitextElement("label", range.label()));
        LiftXml.addIfPresent(element, LiftXml.multitextElement("description", range.description()));
        LiftXml.addIfPresent(element, LiftXml.multitextElement("abbrev", range.abbrev()));

        for (RangeElement rangeElement : range.elements()) {
            if (rangeElement.id() == null || rangeElement.id().isBlank()) {
                throw new InvalidLiftModelException("Element of range " + range.id() + " has no id");
            }

            Element child = LiftXml.element("range-element");
            child.setAttribute("id", rangeElement.id());
            LiftXml.setAttribute(child, "guid", rangeElement.guid());
            LiftXml.setAttribute(child, "parent", rangeElement.parent());
            LiftXml.addIfPresent(child, LiftXml.multitextElement("label", rangeElement.label()));
            LiftXml.addIfPresent(child, LiftXml.multitextElement("description", rangeElement.description()));
            LiftXml.addIfPresent(child, LiftXml.multitextElement("abbrev", rangeElement.abbrev()));
            for (Trait trait : rangeElement.traits()) {
                Element traitElement = LiftXml.element("trait");
                traitElement.setAttribute("name", trait.name());
                traitElement.setAttribute("value", trait.value());
                child.addContent(traitElement);
            }
            element.addContent(child);
        }
        return element;
    }
}
