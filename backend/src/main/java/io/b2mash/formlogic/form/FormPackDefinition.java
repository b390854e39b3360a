package io.b2mash.formlogic.form;

import io.b2mash.formlogic.structure.FormStructure;

/** DTO record for deserializing form pack JSON files from the classpath. */
public record FormPackDefinition(String packId, int version, FormStructure form) {}
