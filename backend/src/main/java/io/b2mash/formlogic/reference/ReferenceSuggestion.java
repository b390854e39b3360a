package io.b2mash.formlogic.reference;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FieldType;

public record ReferenceSuggestion(
    @JsonProperty("field_id") long fieldId,
    @JsonProperty("name") String name,
    @JsonProperty("label") String label,
    @JsonProperty("field_type") FieldType fieldType,
    @JsonProperty("page_title") String pageTitle) {}
