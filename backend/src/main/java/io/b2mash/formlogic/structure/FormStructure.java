package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.formlogic.exception.StructuralReferenceException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only snapshot of a form's structural graph. Pages are kept in structural order ({@code
 * order}, then id); lookups that the engine relies on raise {@link StructuralReferenceException}
 * when the graph points at something it does not contain.
 */
public record FormStructure(
    @JsonProperty("id") long id,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("pages") List<FormPage> pages) {

  public FormStructure {
    pages =
        pages != null
            ? pages.stream()
                .sorted(Comparator.comparingInt(FormPage::order).thenComparingLong(FormPage::id))
                .toList()
            : List.of();
  }

  public Optional<FormPage> findPage(long pageId) {
    return pages.stream().filter(p -> p.id() == pageId).findFirst();
  }

  public FormPage requirePage(long pageId) {
    return findPage(pageId)
        .orElseThrow(
            () ->
                new StructuralReferenceException(
                    "page", pageId, "Form " + id + " has no page with id " + pageId));
  }

  /** The page flagged {@code is_first}, falling back to the first page in structural order. */
  public Optional<FormPage> firstPage() {
    return pages.stream()
        .filter(FormPage::isFirst)
        .findFirst()
        .or(() -> pages.stream().findFirst());
  }

  public Optional<FormPage> nextPageAfter(FormPage page) {
    int index = indexOf(page);
    return index >= 0 && index + 1 < pages.size()
        ? Optional.of(pages.get(index + 1))
        : Optional.empty();
  }

  public int indexOf(FormPage page) {
    for (int i = 0; i < pages.size(); i++) {
      if (pages.get(i).id() == page.id()) {
        return i;
      }
    }
    return -1;
  }

  public List<FormField> allFields() {
    return pages.stream().flatMap(p -> p.fields().stream()).toList();
  }

  public Optional<FormField> findField(long fieldId) {
    return allFields().stream().filter(f -> f.id() == fieldId).findFirst();
  }

  public FormField requireField(long fieldId) {
    return findField(fieldId)
        .orElseThrow(
            () ->
                new StructuralReferenceException(
                    "field", fieldId, "Form " + id + " has no field with id " + fieldId));
  }

  public Optional<FormField> findFieldByName(String name) {
    return allFields().stream().filter(f -> f.name().equals(name)).findFirst();
  }
}
