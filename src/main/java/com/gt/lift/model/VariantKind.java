package com.gt.lift.model;

public enum VariantKind {
    DIRECT,
    RELATION
}
