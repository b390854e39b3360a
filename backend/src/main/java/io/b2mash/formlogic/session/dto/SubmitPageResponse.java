package io.b2mash.formlogic.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of submitting a page.
 *
 * @param skippedPageIds pages passed over because every field on them was skipped
 */
public record SubmitPageResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("next_page_id") Long nextPageId,
    @JsonProperty("is_complete") boolean isComplete,
    @JsonProperty("skipped_page_ids") List<Long> skippedPageIds,
    @JsonProperty("message") String message) {}
