package com.gt.lift.model;

import java.util.ArrayList;
import java.util.List;

public record Example(String source,
                      Multitext form,
                      List<Translation> translations,
                      List<Note> notes,
                      List<Field> fields,
                      List<Trait> traits,
                      List<ExtensionElement> extensions) {

    public Example {
        form = Models.textOf(form);
        translations = Models.listOf(translations);
        notes = Models.listOf(notes);
        fields = Models.listOf(fields);
        traits = Models.listOf(traits);
        extensions = Models.listOf(extensions);
    }

    public Example(Multitext form, List<Translation> translations) {
        this(null, form, translations, List.of(), List.of(), List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String source;
        private Multitext form = Multitext.EMPTY;
        private final List<Translation> translations = new ArrayList<>();
        private final List<Note> notes = new ArrayList<>();
        private final List<Field> fields = new ArrayList<>();
        private final List<Trait> traits = new ArrayList<>();
        private final List<ExtensionElement> extensions = new ArrayList<>();

        private Builder() { }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder form(Multitext form) {
            this.form = form;
            return this;
        }

        public Builder translation(Translation translation) {
            translations.add(translation);
            return this;
        }

        public Builder note(Note note) {
            notes.add(note);
            return this;
        }

        public Builder field(Field field) {
            fields.add(field);
            return this;
        }

        public Builder trait(Trait trait) {
            traits.add(trait);
            return this;
        }

        public Builder extension(ExtensionElement extension) {
            extensions.add(extension);
            return this;
        }

        public Example build() {
            return new Example(source, form, translations, notes, fields, traits, extensions);
        }
    }
}
