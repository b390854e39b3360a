package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** One page of a form: its fields in display order and its outgoing navigation rules. */
public record FormPage(
    @JsonProperty("id") long id,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("order") int order,
    @JsonProperty("is_first") boolean isFirst,
    @JsonProperty("fields") List<FormField> fields,
    @JsonProperty("navigation_rules") List<NavigationRule> navigationRules) {

  public FormPage {
    fields =
        fields != null
            ? fields.stream()
                .sorted(Comparator.comparingInt(FormField::order).thenComparingLong(FormField::id))
                .toList()
            : List.of();
    navigationRules = navigationRules != null ? List.copyOf(navigationRules) : List.of();
  }

  public Optional<NavigationRule> defaultRule() {
    return navigationRules.stream().filter(NavigationRule::isDefault).findFirst();
  }
}
