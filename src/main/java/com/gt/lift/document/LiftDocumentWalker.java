package com.gt.lift.document;

import com.gt.lift.model.Annotation;
import com.gt.lift.model.Entry;
import com.gt.lift.model.Etymology;
import com.gt.lift.model.Example;
import com.gt.lift.model.Field;
import com.gt.lift.model.FieldDeclaration;
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

import java.util.List;
import java.util.function.Consumer;

// Visits every multitext and every trait list of a document, header included
class LiftDocumentWalker {

    private final Consumer<Multitext> multitextVisitor;
    private final Consumer<List<Trait>> traitVisitor;

    LiftDocumentWalker(Consumer<Multitext> multitextVisitor, Consumer<List<Trait>> traitVisitor) {
        this.multitextVisitor = multitextVisitor;
        this.traitVisitor = traitVisitor;
    }

    void walk(LiftDocument document) {
        multitextVisitor.accept(document.header().description());
        for (FieldDeclaration declaration : document.header().fieldDeclarations()) {
            multitextVisitor.accept(declaration.description());
        }
        document.entries().forEach(this::entry);
    }

    private void entry(Entry entry) {
        multitextVisitor.accept(entry.lexicalUnit());
        multitextVisitor.accept(entry.citationForm());
        grammaticalInfo(entry.grammaticalInfo());
        entry.pronunciations().forEach(this::pronunciation);
        entry.senses().forEach(this::sense);
        entry.variants().forEach(this::variant);
        relations(entry.relations());
        for (Etymology etymology : entry.etymologies()) {
            multitextVisitor.accept(etymology.form());
            multitextVisitor.accept(etymology.gloss());
            fields(etymology.fields());
            traitVisitor.accept(etymology.traits());
        }
        notes(entry.notes());
        fields(entry.fields());
        traitVisitor.accept(entry.traits());
        annotations(entry.annotations());
    }

    private void sense(Sense sense) {
        grammaticalInfo(sense.grammaticalInfo());
        multitextVisitor.accept(sense.gloss());
        multitextVisitor.accept(sense.definition());
        relations(sense.relations());
        for (Example example : sense.examples()) {
            multitextVisitor.accept(example.form());
            for (Translation translation : example.translations()) {
                multitextVisitor.accept(translation.form());
            }
            notes(example.notes());
            fields(example.fields());
            traitVisitor.accept(example.traits());
        }
        notes(sense.notes());
        fields(sense.fields());
        traitVisitor.accept(sense.traits());
        annotations(sense.annotations());
        sense.subsenses().forEach(this::sense);
    }

    private void variant(Variant variant) {
        multitextVisitor.accept(variant.form());
        traitVisitor.accept(variant.traits());
        grammaticalInfo(variant.grammaticalInfo());
        variant.pronunciations().forEach(this::pronunciation);
        relations(variant.relations());
        fields(variant.fields());
    }

    private void pronunciation(Pronunciation pronunciation) {
        multitextVisitor.accept(pronunciation.form());
        for (Media media : pronunciation.media()) {
            multitextVisitor.accept(media.label());
        }
        fields(pronunciation.fields());
        traitVisitor.accept(pronunciation.traits());
    }

    private void grammaticalInfo(GrammaticalInfo grammaticalInfo) {
        if (grammaticalInfo != null) {
            traitVisitor.accept(grammaticalInfo.traits());
        }
    }

    private void relations(List<Relation> relations) {
        for (Relation relation : relations) {
            traitVisitor.accept(relation.traits());
        }
    }

    private void fields(List<Field> fields) {
        for (Field field : fields) {
            multitextVisitor.accept(field.content());
            traitVisitor.accept(field.traits());
        }
    }

    private void notes(List<Note> notes) {
        for (Note note : notes) {
            multitextVisitor.accept(note.content());
        }
    }

    private void annotations(List<Annotation> annotations) {
        for (Annotation annotation : annotations) {
            multitextVisitor.accept(annotation.content());
        }
    }
}
