package com.gt.lift.generator;

import com.gt.lift.exception.InvalidLiftModelException;
import com.gt.lift.model.Annotation;
import com.gt.lift.model.Entry;
import com.gt.lift.model.Etymology;
import com.gt.lift.model.Example;
import com.gt.lift.model.ExtensionElement;
import com.gt.lift.model.Field;
import com.gt.lift.model.GrammaticalInfo;
import com.gt.lift.model.LiftDocument;
import com.gt.lift.model.Media;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.Note;
import com.gt.lift.model.Pronunciation;
import com.gt.lift.model.Relation;
import com.gt.lift.model.Sense;
import com.gt.lift.model.Trait;
import com.gt.lift.model.Translation;
import com.gt.lift.model.Variant;
import com.gt.lift.xml.LiftExtensions;
import com.gt.lift.xml.LiftXml;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.output.XMLOutputter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes a {@link LiftDocument} as LIFT 0.13 XML in the default LIFT namespace. Child elements are written
 * in a fixed order per construct, repeated kinds keep their model order, and empty multitexts and
 * collections are left out. The generator checks required identifiers but never invents them.
 */
public class LiftGenerator {

    private static final Logger log = LoggerFactory.getLogger(LiftGenerator.class);

    private final String defaultProducer;
    private final XMLOutputter outputter;
    private final HeaderGenerator headerGenerator = new HeaderGenerator();

    public LiftGenerator(String defaultProducer, boolean prettyPrint) {
        this.defaultProducer = defaultProducer;
        this.outputter = LiftXml.outputter(prettyPrint);
    }

    public String generate(LiftDocument document) {
        String xml = outputter.outputString(toXml(document));
        log.debug("Generated {} LIFT entries ({} characters)", document.entries().size(), xml.length());
        return xml;
    }

    public byte[] generateBytes(LiftDocument document) {
        return generate(document).getBytes(StandardCharsets.UTF_8);
    }

    public void generate(LiftDocument document, OutputStream out) throws IOException {
        outputter.output(toXml(document), out);
    }

    // A standalone <entry> element, as stored per entry in an XML database
    public String generateEntry(Entry entry) {
        return outputter.outputString(entryElement(entry));
    }

    private Document toXml(LiftDocument document) {
        Element root = LiftXml.element("lift");
        root.setAttribute("version", LiftXml.LIFT_VERSION);
        LiftXml.setAttribute(root, "producer", document.producer() != null ? document.producer() : defaultProducer);

        LiftXml.addIfPresent(root, headerGenerator.generate(document.header()));
        for (Entry entry : document.entries()) {
            root.addContent(entryElement(entry));
        }
        return new Document(root);
    }

    private Element entryElement(Entry entry) {
        require(entry.id(), "Entry has no id");

        Element element = LiftXml.element("entry");
        element.setAttribute("id", entry.id());
        LiftXml.setAttribute(element, "guid", entry.guid());
        LiftXml.setAttribute(element, "order", entry.order());
        LiftXml.setAttribute(element, "dateCreated", entry.dateCreated());
        LiftXml.setAttribute(element, "dateModified", entry.dateModified());
        LiftXml.setAttribute(element, "dateDeleted", entry.dateDeleted());

        LiftXml.addIfPresent(element, LiftXml.multitextElement("lexical-unit", entry.lexicalUnit()));
        LiftXml.addIfPresent(element, LiftXml.multitextElement("citation", entry.citationForm()));
        entry.pronunciations().forEach(pronunciation -> element.addContent(pronunciationElement(pronunciation)));
        entry.senses().forEach(sense -> element.addContent(senseElement(sense, "sense")));
        entry.variants().forEach(variant -> element.addContent(variantElement(variant)));
        addRelations(element, entry.relations());
        entry.etymologies().forEach(etymology -> element.addContent(etymologyElement(etymology)));
        addFields(element, entry.fields());
        addNotes(element, entry.notes());
        LiftXml.addIfPresent(element, grammaticalInfoElement(entry.grammaticalInfo()));
        addTraits(element, entry.traits());
        addAnnotations(element, entry.annotations());
        addExtensions(element, entry.extensions());
        return element;
    }

    private Element senseElement(Sense sense, String name) {
        Element element = LiftXml.element(name);
        LiftXml.setAttribute(element, "id", sense.id());
        LiftXml.setAttribute(element, "order", sense.order());

        LiftXml.addIfPresent(element, grammaticalInfoElement(sense.grammaticalInfo()));
        addGlosses(element, sense.gloss());
        LiftXml.addIfPresent(element, LiftXml.multitextElement("definition", sense.definition()));
        addRelations(element, sense.relations());
        addNotes(element, sense.notes());
        sense.examples().forEach(example -> element.addContent(exampleElement(example)));
        addFields(element, sense.fields());
        addTraits(element, sense.traits());
        addAnnotations(element, sense.annotations());
        sense.subsenses().forEach(subsense -> element.addContent(senseElement(subsense, "subsense")));
        addExtensions(element, sense.extensions());
        return element;
    }

    private Element variantElement(Variant variant) {
        Element element = LiftXml.element("variant");
        LiftXml.setAttribute(element, "ref", variant.ref());

        LiftXml.addForms(element, variant.form());
        variant.pronunciations().forEach(pronunciation -> element.addContent(pronunciationElement(pronunciation)));
        LiftXml.addIfPresent(element, grammaticalInfoElement(variant.grammaticalInfo()));
        addRelations(element, variant.relations());
        addFields(element, variant.fields());
        addTraits(element, variant.traits());
        addExtensions(element, variant.extensions());
        return element;
    }

    private Element pronunciationElement(Pronunciation pronunciation) {
        Element element = LiftXml.element("pronunciation");
        LiftXml.addForms(element, pronunciation.form());
        for (Media media : pronunciation.media()) {
            require(media.href(), "Pronunciation media has no href");
            Element mediaElement = LiftXml.element("media");
            mediaElement.setAttribute("href", media.href());
            LiftXml.addIfPresent(mediaElement, LiftXml.multitextElement("label", media.label()));
            element.addContent(mediaElement);
        }
        addFields(element, pronunciation.fields());
        addTraits(element, pronunciation.traits());
        addExtensions(element, pronunciation.extensions());
        return element;
    }

    private Element exampleElement(Example example) {
        Element element = LiftXml.element("example");
        LiftXml.setAttribute(element, "source", example.source());
        LiftXml.addForms(element, example.form());
        for (Translation translation : example.translations()) {
            Element translationElement = LiftXml.element("translation");
            LiftXml.setAttribute(translationElement, "type", translation.type());
            LiftXml.addForms(translationElement, translation.form());
            element.addContent(translationElement);
        }
        addNotes(element, example.notes());
        addFields(element, example.fields());
        addTraits(element, example.traits());
        addExtensions(element, example.extensions());
        return element;
    }

    private Element etymologyElement(Etymology etymology) {
        Element element = LiftXml.element("etymology");
        LiftXml.setAttribute(element, "type", etymology.type());
        LiftXml.setAttribute(element, "source", etymology.source());
        LiftXml.addForms(element, etymology.form());
        addGlosses(element, etymology.gloss());
        addFields(element, etymology.fields());
        addTraits(element, etymology.traits());
        return element;
    }

    private Element grammaticalInfoElement(GrammaticalInfo grammaticalInfo) {
        if (grammaticalInfo == null) {
            return null;
        }
        require(grammaticalInfo.value(), "Grammatical info has no value");

        Element element = LiftXml.element("grammatical-info");
        element.setAttribute("value", grammaticalInfo.value());
        addTraits(element, grammaticalInfo.traits());
        return element;
    }

    // Traits under a relation are written for every relation type, including _component-lexeme
    private void addRelations(Element parent, List<Relation> relations) {
        for (Relation relation : relations) {
            require(relation.type(), "Relation has no type");
            require(relation.ref(), "Relation of type " + relation.type() + " has no ref");

            Element element = LiftXml.element("relation");
            element.setAttribute("type", relation.type());
            element.setAttribute("ref", relation.ref());
            LiftXml.setAttribute(element, "order", relation.order());
            addTraits(element, relation.traits());
            parent.addContent(element);
        }
    }

    private void addTraits(Element parent, List<Trait> traits) {
        for (Trait trait : traits) {
            require(trait.name(), "Trait has no name");
            if (trait.value() == null) {
                throw new InvalidLiftModelException("Trait " + trait.name() + " has no value");
            }

            Element element = LiftXml.element("trait");
            element.setAttribute("name", trait.name());
            element.setAttribute("value", trait.value());
            parent.addContent(element);
        }
    }

    private void addFields(Element parent, List<Field> fields) {
        for (Field field : fields) {
            require(field.type(), "Field has no type");

            Element element = LiftXml.element("field");
            element.setAttribute("type", field.type());
            LiftXml.addForms(element, field.content());
            addTraits(element, field.traits());
            parent.addContent(element);
        }
    }

    private void addNotes(Element parent, List<Note> notes) {
        for (Note note : notes) {
            Element element = LiftXml.element("note");
            LiftXml.setAttribute(element, "type", note.type());
            LiftXml.addForms(element, note.content());
            parent.addContent(element);
        }
    }

    private void addAnnotations(Element parent, List<Annotation> annotations) {
        for (Annotation annotation : annotations) {
            require(annotation.name(), "Annotation has no name");

            Element element = LiftXml.element("annotation");
            element.setAttribute("name", annotation.name());
            LiftXml.setAttribute(element, "value", annotation.value());
            LiftXml.setAttribute(element, "who", annotation.who());
            LiftXml.setAttribute(element, "when", annotation.when());
            LiftXml.addForms(element, annotation.content());
            parent.addContent(element);
        }
    }

    // Gloss shape: one <gloss lang><text/></gloss> per language
    private void addGlosses(Element parent, Multitext gloss) {
        gloss.asMap().forEach((lang, text) -> {
            if (!text.isBlank()) {
                Element element = LiftXml.element("gloss");
                element.setAttribute("lang", lang);
                element.addContent(LiftXml.element("text").setText(text));
                parent.addContent(element);
            }
        });
    }

    private void addExtensions(Element parent, List<ExtensionElement> extensions) {
        for (ExtensionElement extension : extensions) {
            parent.addContent(LiftExtensions.restore(extension));
        }
    }

    private static void require(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidLiftModelException(message);
        }
    }
}
