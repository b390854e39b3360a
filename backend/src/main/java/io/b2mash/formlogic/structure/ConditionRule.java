package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.condition.ConditionAction;
import io.b2mash.formlogic.condition.ConditionOperator;

/**
 * A predicate over another field's current answer, attached to the field whose render state it
 * changes. Rules of one field are evaluated in list order.
 *
 * @param sourceFieldName name of the field whose answer is tested; never the owning field
 * @param operator comparison operator, {@code null} when the stored name is not recognised
 * @param value literal operand; absent for emptiness checks
 * @param action effect applied to the owning field when the predicate matches
 */
public record ConditionRule(
    @JsonProperty("source_field_name") String sourceFieldName,
    @JsonProperty("operator") ConditionOperator operator,
    @JsonProperty("value") String value,
    @JsonProperty("action") ConditionAction action) {}
