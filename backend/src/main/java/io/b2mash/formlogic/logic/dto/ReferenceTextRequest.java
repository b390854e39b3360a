package io.b2mash.formlogic.logic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.reference.ReferenceField;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Text to convert or segment, with the fields its references may bind to. */
public record ReferenceTextRequest(
    @JsonProperty("text") @NotNull String text,
    @JsonProperty("fields") List<ReferenceField> fields) {

  public ReferenceTextRequest {
    fields = fields != null ? fields : List.of();
  }
}
