package com.gt.lift.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.lift.serialization.MultitextDeserializer;
import com.gt.lift.serialization.MultitextSerializer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// Language tag -> text. Equality ignores insertion order, iteration keeps it.
@JsonSerialize(using = MultitextSerializer.class)
@JsonDeserialize(using = MultitextDeserializer.class)
public final class Multitext {

    public static final Multitext EMPTY = new Multitext(new LinkedHashMap<>());

    private final Map<String, String> forms;

    private Multitext(LinkedHashMap<String, String> forms) {
        this.forms = Collections.unmodifiableMap(forms);
    }

    public static Multitext of(String lang, String text) {
        return builder().put(lang, text).build();
    }

    public static Multitext of(String lang1, String text1, String lang2, String text2) {
        return builder().put(lang1, text1).put(lang2, text2).build();
    }

    public static Multitext of(Map<String, String> forms) {
        if (forms == null || forms.isEmpty()) {
            return EMPTY;
        }

        Builder builder = builder();
        forms.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String get(String lang) {
        return forms.get(lang);
    }

    public Optional<String> find(String lang) {
        return Optional.ofNullable(forms.get(lang));
    }

    // First text in insertion order, or empty string
    public String first() {
        return forms.isEmpty() ? "" : forms.values().iterator().next();
    }

    public Set<String> languages() {
        return forms.keySet();
    }

    public Map<String, String> asMap() {
        return forms;
    }

    public boolean isEmpty() {
        return forms.isEmpty();
    }

    public int size() {
        return forms.size();
    }

    public Multitext with(String lang, String text) {
        Builder builder = toBuilder();
        builder.put(lang, text);
        return builder.build();
    }

    public Multitext without(String lang) {
        if (!forms.containsKey(lang)) {
            return this;
        }

        LinkedHashMap<String, String> copy = new LinkedHashMap<>(forms);
        copy.remove(lang);
        return copy.isEmpty() ? EMPTY : new Multitext(copy);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.forms.putAll(forms);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Multitext other && forms.equals(other.forms);
    }

    @Override
    public int hashCode() {
        return forms.hashCode();
    }

    @Override
    public String toString() {
        return forms.toString();
    }

    public static class Builder {

        private final LinkedHashMap<String, String> forms = new LinkedHashMap<>();

        private Builder() { }

        // Last write for a language wins. Blank text is not a form and is ignored.
        public Builder put(String lang, String text) {
            if (lang == null || lang.isBlank()) {
                throw new IllegalArgumentException("Multitext language tag must not be blank");
            }
            if (text == null) {
                throw new IllegalArgumentException("Multitext text for language " + lang + " must not be null");
            }
            if (text.isBlank()) {
                return this;
            }

            forms.put(lang, text);
            return this;
        }

        public Builder putAll(Multitext other) {
            other.forms.forEach(this::put);
            return this;
        }

        public boolean isEmpty() {
            return forms.isEmpty();
        }

        public Multitext build() {
            return forms.isEmpty() ? EMPTY : new Multitext(new LinkedHashMap<>(forms));
        }
    }
}
