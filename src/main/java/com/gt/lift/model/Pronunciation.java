package com.gt.lift.model;

import java.util.ArrayList;
import java.util.List;

// cv-pattern and tone are carried as ordinary fields so new field types need no model change
public record Pronunciation(Multitext form,
                            List<Media> media,
                            List<Field> fields,
                            List<Trait> traits,
                            List<ExtensionElement> extensions) {

    public static final String CV_PATTERN_FIELD = "cv-pattern";
    public static final String TONE_FIELD = "tone";

    public Pronunciation {
        form = Models.textOf(form);
        media = Models.listOf(media);
        fields = Models.listOf(fields);
        traits = Models.listOf(traits);
        extensions = Models.listOf(extensions);
    }

    public Pronunciation(Multitext form) {
        this(form, List.of(), List.of(), List.of(), List.of());
    }

    public Multitext cvPattern() {
        return Field.find(fields, CV_PATTERN_FIELD).map(Field::content).orElse(Multitext.EMPTY);
    }

    public Multitext tone() {
        return Field.find(fields, TONE_FIELD).map(Field::content).orElse(Multitext.EMPTY);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.form = form;
        builder.media.addAll(media);
        builder.fields.addAll(fields);
        builder.traits.addAll(traits);
        builder.extensions.addAll(extensions);
        return builder;
    }

    public static class Builder {
        private Multitext form = Multitext.EMPTY;
        private final List<Media> media = new ArrayList<>();
        private final List<Field> fields = new ArrayList<>();
        private final List<Trait> traits = new ArrayList<>();
        private final List<ExtensionElement> extensions = new ArrayList<>();

        private Builder() { }

        public Builder form(Multitext form) {
            this.form = form;
            return this;
        }

        public Builder media(Media media) {
            this.media.add(media);
            return this;
        }

        public Builder field(Field field) {
            fields.add(field);
            return this;
        }

        public Builder cvPattern(Multitext cvPattern) {
            return field(new Field(CV_PATTERN_FIELD, cvPattern));
        }

        public Builder tone(Multitext tone) {
            return field(new Field(TONE_FIELD, tone));
        }

        public Builder trait(Trait trait) {
            traits.add(trait);
            return this;
        }

        public Builder extension(ExtensionElement extension) {
            extensions.add(extension);
            return this;
        }

        public Pronunciation build() {
            return new Pronunciation(form, media, fields, traits, extensions);
        }
    }
}
