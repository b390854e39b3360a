package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Supported field types for form fields. */
public enum FieldType {
  TEXT,
  TEXTAREA,
  NUMBER,
  EMAIL,
  PHONE,
  DATE,
  DATETIME,
  SELECT,
  MULTISELECT,
  RADIO,
  CHECKBOX,
  BOOLEAN,
  RATING,
  FILE,
  PARAGRAPH;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean hasChoices() {
    return this == SELECT || this == MULTISELECT || this == RADIO || this == CHECKBOX;
  }

  @JsonCreator
  public static FieldType fromValue(String value) {
    for (var type : values()) {
      if (type.value().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown field type: " + value);
  }
}
