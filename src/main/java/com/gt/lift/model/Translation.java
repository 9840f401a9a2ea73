package com.gt.lift.model;

public record Translation(String type, Multitext form) {

    public Translation {
        form = Models.textOf(form);
    }
}
