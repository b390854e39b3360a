package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.session.SessionStatus;
import java.time.Instant;
import java.util.List;

public record SessionStatusResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("form_id") long formId,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("current_page_id") long currentPageId,
    @JsonProperty("progress") double progress,
    @JsonProperty("visited_page_ids") List<Long> visitedPageIds,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("completed_at") Instant completedAt) {}
