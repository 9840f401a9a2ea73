package com.gt.lift.model;

/**
 * An element the model does not cover, kept verbatim so it can be written back out.
 *
 * @param name local name of the element
 * @param xml compact serialization of the element with LIFT namespace references removed,
 *            so qualified and unqualified sources yield equal values
 */
public record ExtensionElement(String name, String xml) {
}
