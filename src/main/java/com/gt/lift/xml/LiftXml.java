package com.gt.lift.xml;

import com.gt.lift.model.Multitext;
import org.jdom2.Attribute;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.jdom2.output.Format;
import org.jdom2.output.LineSeparator;
import org.jdom2.output.XMLOutputter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Low-level traversal and construction primitives shared by the entry, header and ranges codecs.
 * <p>
 * Every lookup accepts an element either in one of the LIFT namespaces or in no namespace at all, so
 * {@code <lift:entry>} and {@code <entry>} are read the same way.
 */
public final class LiftXml {

    public static final String LIFT_VERSION = "0.13";
    public static final String LIFT_NAMESPACE_URI = "http://fieldworks.sil.org/schemas/lift/0.13";
    public static final String RANGES_NAMESPACE_URI = "http://fieldworks.sil.org/schemas/lift/0.13/ranges";
    public static final String LIFT_PREFIX = "lift";
    public static final Namespace LIFT_NAMESPACE = Namespace.getNamespace(LIFT_NAMESPACE_URI);

    public static final String UNDETERMINED_LANGUAGE = "und";

    private static final Set<String> ACCEPTED_NAMESPACES = Set.of("", LIFT_NAMESPACE_URI, RANGES_NAMESPACE_URI);

    private LiftXml() { }

    // ---- lookup ----

    public static boolean isNamed(Element element, String localName) {
        return element.getName().equals(localName) && ACCEPTED_NAMESPACES.contains(element.getNamespaceURI());
    }

    public static boolean isLiftNamespace(String namespaceUri) {
        return ACCEPTED_NAMESPACES.contains(namespaceUri);
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.getChildren()) {
            if (isNamed(child, localName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public static Element child(Element parent, String localName) {
        for (Element child : parent.getChildren()) {
            if (isNamed(child, localName)) {
                return child;
            }
        }
        return null;
    }

    // Unqualified attribute first, then the same local name in a LIFT namespace
    public static String attribute(Element element, String name) {
        String value = element.getAttributeValue(name);
        if (value != null) {
            return value;
        }
        for (Attribute attribute : element.getAttributes()) {
            if (attribute.getName().equals(name) && ACCEPTED_NAMESPACES.contains(attribute.getNamespaceURI())) {
                return attribute.getValue();
            }
        }
        return null;
    }

    /**
     * Flattens the multilingual content of one or more elements into a single {@link Multitext}. Each
     * element contributes its {@code <form lang><text>} children, and, for the gloss shape, its own
     * {@code lang} attribute paired with its {@code <text>} child. Later duplicates of a language win.
     * Forms with blank text are skipped.
     */
    public static Multitext multitext(List<Element> elements) {
        Multitext.Builder builder = Multitext.builder();
        for (Element element : elements) {
            readMultitext(element, builder);
        }
        return builder.build();
    }

    public static Multitext multitext(Element element) {
        if (element == null) {
            return Multitext.EMPTY;
        }
        Multitext.Builder builder = Multitext.builder();
        readMultitext(element, builder);
        return builder.build();
    }

    private static void readMultitext(Element element, Multitext.Builder builder) {
        String ownLang = attribute(element, "lang");
        if (ownLang != null) {
            putForm(builder, ownLang, element);
        }
        for (Element form : children(element, "form")) {
            putForm(builder, attribute(form, "lang"), form);
        }
    }

    private static void putForm(Multitext.Builder builder, String lang, Element form) {
        String text = formText(form);
        if (text == null || text.isBlank()) {
            return;
        }
        builder.put(lang == null || lang.isBlank() ? UNDETERMINED_LANGUAGE : lang, text);
    }

    // Value of the <text> child, including any <span> content. Falls back to the element's own text.
    private static String formText(Element form) {
        Element text = child(form, "text");
        if (text != null) {
            return text.getValue();
        }
        return form.getTextTrim();
    }

    /**
     * Human readable location of an element, e.g. {@code /lift/entry[@id='cat']/relation[2]}.
     */
    public static String path(Element element) {
        List<String> segments = new ArrayList<>();
        Element current = element;
        while (current != null) {
            segments.add(0, segment(current));
            current = current.getParentElement();
        }
        return "/" + String.join("/", segments);
    }

    private static String segment(Element element) {
        String id = element.getAttributeValue("id");
        if (id != null && !id.isBlank()) {
            return element.getName() + "[@id='" + id + "']";
        }
        Element parent = element.getParentElement();
        if (parent == null) {
            return element.getName();
        }

        int position = 0;
        for (Element sibling : parent.getChildren()) {
            if (sibling.getName().equals(element.getName())) {
                position++;
            }
            if (sibling == element) {
                break;
            }
        }
        return element.getName() + "[" + position + "]";
    }

    // ---- construction ----

    public static Element element(String name) {
        return new Element(name, LIFT_NAMESPACE);
    }

    public static void setAttribute(Element element, String name, Object value) {
        if (value != null) {
            element.setAttribute(name, value.toString());
        }
    }

    public static Element formElement(String lang, String text) {
        Element form = element("form");
        form.setAttribute("lang", lang);
        form.addContent(element("text").setText(text));
        return form;
    }

    // Blank forms are not written; the reader ignores them
    public static void addForms(Element parent, Multitext multitext) {
        multitext.asMap().forEach((lang, text) -> {
            if (!text.isBlank()) {
                parent.addContent(formElement(lang, text));
            }
        });
    }

    public static boolean hasText(Multitext multitext) {
        return multitext.asMap().values().stream().anyMatch(text -> !text.isBlank());
    }

    // <name><form lang><text/></form>...</name>, or null when there is nothing to write
    public static Element multitextElement(String name, Multitext multitext) {
        if (!hasText(multitext)) {
            return null;
        }
        Element element = element(name);
        addForms(element, multitext);
        return element;
    }

    public static void addIfPresent(Element parent, Element child) {
        if (child != null) {
            parent.addContent(child);
        }
    }

    public static XMLOutputter outputter(boolean prettyPrint) {
        Format format = prettyPrint ? Format.getPrettyFormat() : Format.getRawFormat();
        format.setEncoding("UTF-8");
        format.setLineSeparator(LineSeparator.UNIX);
        if (prettyPrint) {
            format.setIndent("  ");
            // Keeps text inside <text> exactly as modeled
            format.setTextMode(Format.TextMode.TRIM_FULL_WHITE);
        }
        return new XMLOutputter(format);
    }
}
