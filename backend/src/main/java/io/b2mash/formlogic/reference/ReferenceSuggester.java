package io.b2mash.formlogic.reference;

import io.b2mash.formlogic.structure.FormField;
import io.b2mash.formlogic.structure.FormStructure;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Autocomplete candidates for a partially typed {@code @} reference: non-paragraph fields whose
 * name or label contains the query, case-insensitively, in structural order. A blank query lists
 * every candidate.
 */
@Component
public class ReferenceSuggester {

  public List<ReferenceSuggestion> suggest(FormStructure form, String query, Long excludeFieldId) {
    String needle = query != null ? query.trim().toLowerCase(Locale.ROOT) : "";
    var suggestions = new ArrayList<ReferenceSuggestion>();
    for (var page : form.pages()) {
      for (var field : page.fields()) {
        if (field.isParagraph()
            || (excludeFieldId != null && field.id() == excludeFieldId)
            || !matches(field, needle)) {
          continue;
        }
        suggestions.add(
            new ReferenceSuggestion(
                field.id(), field.name(), field.label(), field.fieldType(), page.title()));
      }
    }
    return suggestions;
  }

  private static boolean matches(FormField field, String needle) {
    if (needle.isEmpty()) {
      return true;
    }
    return field.name().toLowerCase(Locale.ROOT).contains(needle)
        || (field.label() != null && field.label().toLowerCase(Locale.ROOT).contains(needle));
  }
}
