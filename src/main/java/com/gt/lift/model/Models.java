package com.gt.lift.model;

import java.util.List;

// Null-to-empty normalization shared by the model records
final class Models {

    private Models() { }

    static <T> List<T> listOf(List<T> values) {
        return values == null || values.isEmpty() ? List.of() : List.copyOf(values);
    }

    static Multitext textOf(Multitext text) {
        return text == null ? Multitext.EMPTY : text;
    }

    static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
