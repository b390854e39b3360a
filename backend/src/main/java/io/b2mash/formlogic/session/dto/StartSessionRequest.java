package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record StartSessionRequest(
    @JsonProperty("form_id") @NotNull Long formId,
    @JsonProperty("session_id") @Size(max = 100) String sessionId) {}
