package com.gt.lift.xml;

import com.gt.lift.exception.InvalidLiftModelException;
import com.gt.lift.model.ExtensionElement;
import org.jdom2.Content;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;
import org.jdom2.Text;
import org.jdom2.filter.Filters;
import org.jdom2.output.XMLOutputter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts unmodeled elements to and from {@link ExtensionElement}. Captured elements are stored without
 * their LIFT namespace and without whitespace-only text, so the stored form does not depend on whether
 * the source was namespace qualified or pretty printed.
 */
public final class LiftExtensions {

    private static final XMLOutputter RAW_OUTPUTTER = LiftXml.outputter(false);

    private LiftExtensions() { }

    public static ExtensionElement capture(Element element) {
        Element copy = element.clone();
        stripLiftNamespace(copy);
        removeWhitespaceText(copy);
        return new ExtensionElement(copy.getName(), RAW_OUTPUTTER.outputString(copy));
    }

    public static Element restore(ExtensionElement extension) {
        Element element;
        try {
            element = LiftXmlReader.read(extension.xml()).detachRootElement();
        } catch (JDOMException | IOException ex) {
            throw new InvalidLiftModelException("Extension element <" + extension.name() + "> does not hold well-formed XML", ex);
        }
        applyLiftNamespace(element);
        return element;
    }

    private static void stripLiftNamespace(Element element) {
        if (LiftXml.isLiftNamespace(element.getNamespaceURI())) {
            element.setNamespace(Namespace.NO_NAMESPACE);
        }
        for (Namespace declared : new ArrayList<>(element.getAdditionalNamespaces())) {
            if (LiftXml.isLiftNamespace(declared.getURI())) {
                element.removeNamespaceDeclaration(declared);
            }
        }
        for (Element child : element.getChildren()) {
            stripLiftNamespace(child);
        }
    }

    private static void applyLiftNamespace(Element element) {
        if (element.getNamespaceURI().isEmpty()) {
            element.setNamespace(LiftXml.LIFT_NAMESPACE);
        }
        for (Element child : element.getChildren()) {
            applyLiftNamespace(child);
        }
    }

    private static void removeWhitespaceText(Element element) {
        List<Content> blank = new ArrayList<>();
        for (Text text : element.getDescendants(Filters.text())) {
            if (text.getText().isBlank()) {
                blank.add(text);
            }
        }
        blank.forEach(Content::detach);
    }
}
