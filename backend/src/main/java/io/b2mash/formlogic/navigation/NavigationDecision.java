package io.b2mash.formlogic.navigation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of leaving a page: either the id of the page to show next or completion of the form.
 *
 * @param nextPageId target page, {@code null} exactly when {@code complete} is set
 * @param complete whether the form is finished
 * @param reason which step of the resolution produced the decision
 */
public record NavigationDecision(
    @JsonProperty("next_page_id") Long nextPageId,
    @JsonProperty("is_complete") boolean complete,
    @JsonProperty("reason") Reason reason) {

  public enum Reason {
    RULE_MATCH,
    DEFAULT_RULE,
    STRUCTURAL_ORDER,
    LAST_PAGE
  }

  public static NavigationDecision goTo(long pageId, Reason reason) {
    return new NavigationDecision(pageId, false, reason);
  }

  public static NavigationDecision complete(Reason reason) {
    return new NavigationDecision(null, true, reason);
  }
}
