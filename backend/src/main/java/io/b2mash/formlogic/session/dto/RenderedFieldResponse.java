package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FieldOptions;
import io.b2mash.formlogic.structure.FieldType;

/**
 * A field as the renderer paints it. {@code content} is set for paragraph fields only and holds
 * the paragraph text with references already replaced by answers.
 */
public record RenderedFieldResponse(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name,
    @JsonProperty("label") String label,
    @JsonProperty("field_type") FieldType fieldType,
    @JsonProperty("placeholder") String placeholder,
    @JsonProperty("help_text") String helpText,
    @JsonProperty("default_value") String defaultValue,
    @JsonProperty("options") FieldOptions options,
    @JsonProperty("content") String content,
    @JsonProperty("current_value") Object currentValue,
    @JsonProperty("is_visible") boolean isVisible,
    @JsonProperty("is_required") boolean isRequired,
    @JsonProperty("is_enabled") boolean isEnabled,
    @JsonProperty("is_skipped") boolean isSkipped) {}
