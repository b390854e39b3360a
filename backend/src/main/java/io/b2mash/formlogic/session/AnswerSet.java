package io.b2mash.formlogic.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers of one fill-out session keyed by field name. An absent answer is stored as the empty
 * string so every reached field has an entry. Not thread-safe; the owning {@link FillSession}
 * serializes access.
 */
public class AnswerSet {

  private final Map<String, Object> values = new LinkedHashMap<>();

  public void put(String fieldName, Object value) {
    values.put(fieldName, value != null ? value : "");
  }

  public void putAll(Map<String, Object> answers) {
    answers.forEach(this::put);
  }

  /** Adds an empty entry for {@code fieldName} unless it already has one. */
  public void ensurePresent(String fieldName) {
    values.putIfAbsent(fieldName, "");
  }

  public Object get(String fieldName) {
    return values.get(fieldName);
  }

  public Map<String, Object> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
