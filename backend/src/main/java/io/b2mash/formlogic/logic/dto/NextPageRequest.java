package io.b2mash.formlogic.logic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.structure.FormStructure;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

public record NextPageRequest(
    @JsonProperty("form") @NotNull FormStructure form,
    @JsonProperty("current_page_id") @NotNull Long currentPageId,
    @JsonProperty("answers") Map<String, Object> answers) {

  public NextPageRequest {
    answers = answers != null ? answers : Map.of();
  }
}
