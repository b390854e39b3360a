package io.b2mash.formlogic.form.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FormStructure;

public record FormSummaryResponse(
    @JsonProperty("id") long id,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("page_count") int pageCount,
    @JsonProperty("field_count") int fieldCount) {

  public static FormSummaryResponse from(FormStructure form) {
    return new FormSummaryResponse(
        form.id(), form.title(), form.description(), form.pages().size(), form.allFields().size());
  }
}
