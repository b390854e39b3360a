package io.b2mash.formlogic.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Comparison operators shared by field conditions and navigation rules. Unrecognised operator names
 * deserialize to {@code null}, which every evaluator treats as a non-match.
 */
public enum ConditionOperator {
  EQUALS,
  NOT_EQUALS,
  CONTAINS,
  NOT_CONTAINS,
  IN,
  NOT_IN,
  GREATER_THAN,
  LESS_THAN,
  GREATER_EQUAL,
  LESS_EQUAL,
  IS_EMPTY,
  IS_NOT_EMPTY;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isNumeric() {
    return this == GREATER_THAN || this == LESS_THAN || this == GREATER_EQUAL || this == LESS_EQUAL;
  }

  @JsonCreator
  public static ConditionOperator fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    for (var operator : values()) {
      if (operator.value().equalsIgnoreCase(value.trim())) {
        return operator;
      }
    }
    return null;
  }
}
