package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.condition.ConditionOperator;

/**
 * A page-to-page transition guarded by a predicate over one field's answer. The default rule of a
 * page has no source field and is taken only when no conditioned rule matches; a default rule
 * without a target page completes the form.
 */
public record NavigationRule(
    @JsonProperty("source_field_id") Long sourceFieldId,
    @JsonProperty("operator") ConditionOperator operator,
    @JsonProperty("value") String value,
    @JsonProperty("target_page_id") Long targetPageId,
    @JsonProperty("is_default") boolean isDefault) {}
