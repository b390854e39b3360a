package io.b2mash.formlogic.logic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.reference.ReferenceField;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record InterpolateRequest(
    @JsonProperty("text") @NotNull String text,
    @JsonProperty("fields") List<ReferenceField> fields,
    @JsonProperty("answers") Map<String, Object> answers) {

  public InterpolateRequest {
    fields = fields != null ? fields : List.of();
    answers = answers != null ? answers : Map.of();
  }
}
