package io.b2mash.formlogic.reference;

/**
 * One bound reference inside a text. {@code start} is the index of the {@code @}; {@code end} is
 * exclusive.
 */
public record ReferenceMatch(int start, int end, ReferenceField field) {}
