package com.gt.lift.model;

// A <range id href> pointer in the header; contents live in the ranges document
public record RangeReference(String id, String href) {

    public RangeReference {
        href = Models.blankToNull(href);
    }
}
