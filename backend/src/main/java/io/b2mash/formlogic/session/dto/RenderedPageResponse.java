package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.session.SessionStatus;
import java.util.List;

public record RenderedPageResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("form_id") long formId,
    @JsonProperty("form_title") String formTitle,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("page_id") long pageId,
    @JsonProperty("page_title") String pageTitle,
    @JsonProperty("page_description") String pageDescription,
    @JsonProperty("fields") List<RenderedFieldResponse> fields,
    @JsonProperty("next_page_id") Long nextPageId,
    @JsonProperty("is_complete") boolean isComplete,
    @JsonProperty("progress") double progress) {}
