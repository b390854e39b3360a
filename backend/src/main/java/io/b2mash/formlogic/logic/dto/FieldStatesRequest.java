package io.b2mash.formlogic.logic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FormStructure;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

/** A form snapshot, the page to project and the answers collected so far. */
public record FieldStatesRequest(
    @JsonProperty("form") @NotNull FormStructure form,
    @JsonProperty("page_id") @NotNull Long pageId,
    @JsonProperty("answers") Map<String, Object> answers) {

  public FieldStatesRequest {
    answers = answers != null ? answers : Map.of();
  }
}
