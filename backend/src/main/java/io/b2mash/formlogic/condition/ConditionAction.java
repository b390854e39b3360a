package io.b2mash.formlogic.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a matching condition rule does to the field that owns it. */
public enum ConditionAction {
  SHOW,
  HIDE,
  ENABLE,
  DISABLE,
  REQUIRE,
  SKIP;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Unknown action names map to {@code null}; such rules are evaluated but have no effect. */
  @JsonCreator
  public static ConditionAction fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    for (var action : values()) {
      if (action.value().equalsIgnoreCase(value.trim())) {
        return action;
      }
    }
    return null;
  }
}
