package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Answers keyed by field name; a {@code null} value clears the answer. */
public record AnswersRequest(@JsonProperty("answers") Map<String, Object> answers) {

  public AnswersRequest {
    answers = answers != null ? answers : Map.of();
  }
}
