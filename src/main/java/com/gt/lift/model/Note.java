package com.gt.lift.model;

public record Note(String type, Multitext content) {

    public Note {
        content = Models.textOf(content);
    }
}
