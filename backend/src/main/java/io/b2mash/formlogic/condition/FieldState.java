package io.b2mash.formlogic.condition;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Render state of one field on the current page. */
public record FieldState(
    @JsonProperty("field_id") long fieldId,
    @JsonProperty("name") String name,
    @JsonProperty("is_visible") boolean isVisible,
    @JsonProperty("is_required") boolean isRequired,
    @JsonProperty("is_enabled") boolean isEnabled,
    @JsonProperty("is_skipped") boolean isSkipped) {}
