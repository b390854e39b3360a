package io.b2mash.formlogic.reference;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A run of text in the authoring surface: either plain text or one bound field reference. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReferenceSegment(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("text") String text,
    @JsonProperty("field_id") Long fieldId,
    @JsonProperty("field_name") String fieldName) {

  public enum Kind {
    TEXT,
    REFERENCE
  }

  public static ReferenceSegment text(String text) {
    return new ReferenceSegment(Kind.TEXT, text, null, null);
  }

  public static ReferenceSegment reference(String text, ReferenceField field) {
    return new ReferenceSegment(Kind.REFERENCE, text, field.id(), field.name());
  }
}
