package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FieldType;

public record SessionResponseEntry(
    @JsonProperty("field_id") long fieldId,
    @JsonProperty("name") String name,
    @JsonProperty("label") String label,
    @JsonProperty("field_type") FieldType fieldType,
    @JsonProperty("value") Object value) {}
