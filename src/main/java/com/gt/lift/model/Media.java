package com.gt.lift.model;

public record Media(String href, Multitext label) {

    public Media {
        label = Models.textOf(label);
    }

    public Media(String href) {
        this(href, Multitext.EMPTY);
    }
}
