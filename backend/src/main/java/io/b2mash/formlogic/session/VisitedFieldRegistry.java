package io.b2mash.formlogic.session;

import io.b2mash.formlogic.structure.FormField;
import io.b2mash.formlogic.structure.FormPage;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only record of the pages and answer-collecting fields a session has reached. Entries are
 * never removed, so a field reached once keeps its answer slot even if navigation later leaves its
 * page.
 */
public class VisitedFieldRegistry {

  private final Set<Long> pageIds = new LinkedHashSet<>();
  private final Set<String> fieldNames = new LinkedHashSet<>();

  /**
   * Records a page visit.
   *
   * @return names of the fields reached for the first time, in page order
   */
  public List<String> recordPage(FormPage page) {
    pageIds.add(page.id());
    var added = new ArrayList<String>();
    for (FormField field : page.fields()) {
      if (!field.isParagraph() && fieldNames.add(field.name())) {
        added.add(field.name());
      }
    }
    return added;
  }

  public boolean hasVisited(long pageId) {
    return pageIds.contains(pageId);
  }

  public boolean hasReached(String fieldName) {
    return fieldNames.contains(fieldName);
  }

  public List<Long> pageIds() {
    return List.copyOf(pageIds);
  }

  public List<String> fieldNames() {
    return List.copyOf(fieldNames);
  }
}
