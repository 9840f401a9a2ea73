package com.gt.lift.model;

import java.util.List;
import java.util.Optional;

public record Trait(String name, String value) {

    public static Optional<String> find(List<Trait> traits, String name) {
        return traits.stream()
                .filter(trait -> name.equals(trait.name()))
                .map(Trait::value)
                .findFirst();
    }

    public static List<String> findAll(List<Trait> traits, String name) {
        return traits.stream()
                .filter(trait -> name.equals(trait.name()))
                .map(Trait::value)
                .toList();
    }
}
