package io.b2mash.formlogic.reference;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FieldType;
import io.b2mash.formlogic.structure.FormField;

/** The slice of a field that text references need: its id, its name and how to format it. */
public record ReferenceField(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name,
    @JsonProperty("field_type") FieldType fieldType) {

  public static ReferenceField from(FormField field) {
    return new ReferenceField(field.id(), field.name(), field.fieldType());
  }
}
