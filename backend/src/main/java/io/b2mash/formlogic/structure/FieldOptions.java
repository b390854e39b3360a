package io.b2mash.formlogic.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type-specific field options. Which variant a field carries is decided by its {@link FieldType}:
 * choice fields get {@link Choices}, rating fields a {@link Range}, file fields an {@link
 * Attachment}, everything else {@link None}.
 *
 * <p>On the wire options stay the loose JSON object the authoring surface writes ({@code
 * {"choices": [...]}}, {@code {"min": 1, "max": 5}}, {@code {"attachment": {...}}}); {@link
 * #from(FieldType, Map)} reads it and each variant writes it back in the same shape.
 */
public sealed interface FieldOptions
    permits FieldOptions.Choices, FieldOptions.Range, FieldOptions.Attachment, FieldOptions.None {

  int DEFAULT_RATING_MIN = 1;
  int DEFAULT_RATING_MAX = 5;

  record Choice(String value, String label) {}

  record Choices(List<Choice> choices) implements FieldOptions {

    public Choices {
      choices = choices == null ? List.of() : List.copyOf(choices);
    }

    @JsonValue
    public Map<String, Object> toJson() {
      var rendered = new ArrayList<Map<String, String>>();
      for (var choice : choices) {
        var entry = new LinkedHashMap<String, String>();
        entry.put("value", choice.value());
        entry.put("label", choice.label());
        rendered.add(entry);
      }
      return Map.of("choices", rendered);
    }
  }

  record Range(int min, int max) implements FieldOptions {

    @JsonValue
    public Map<String, Object> toJson() {
      return Map.of("min", min, "max", max);
    }
  }

  record Attachment(String type, String url) implements FieldOptions {

    @JsonValue
    public Map<String, Object> toJson() {
      var attachment = new LinkedHashMap<String, Object>();
      attachment.put("type", type);
      attachment.put("url", url);
      return Map.of("attachment", attachment);
    }
  }

  record None() implements FieldOptions {

    @JsonValue
    public Map<String, Object> toJson() {
      return null;
    }
  }

  FieldOptions NONE = new None();

  static FieldOptions from(FieldType fieldType, Map<String, Object> raw) {
    if (fieldType == null) {
      return NONE;
    }
    Map<String, Object> source = raw != null ? raw : Map.of();
    if (fieldType.hasChoices()) {
      return new Choices(readChoices(source.get("choices")));
    }
    if (fieldType == FieldType.RATING) {
      return new Range(
          readInt(source.get("min"), DEFAULT_RATING_MIN),
          readInt(source.get("max"), DEFAULT_RATING_MAX));
    }
    if (fieldType == FieldType.FILE && source.get("attachment") instanceof Map<?, ?> attachment) {
      Object type = attachment.get("type");
      Object url = attachment.get("url");
      return new Attachment(
          type != null ? type.toString() : "file", url != null ? url.toString() : null);
    }
    return NONE;
  }

  private static List<Choice> readChoices(Object raw) {
    if (!(raw instanceof List<?> list)) {
      return List.of();
    }
    var choices = new ArrayList<Choice>();
    for (Object item : list) {
      if (item instanceof Map<?, ?> map) {
        Object value = map.get("value");
        Object label = map.get("label");
        if (value != null) {
          String text = value.toString();
          choices.add(new Choice(text, label != null ? label.toString() : text));
        }
      } else if (item != null) {
        choices.add(new Choice(item.toString(), item.toString()));
      }
    }
    return choices;
  }

  private static int readInt(Object raw, int fallback) {
    if (raw instanceof Number number) {
      return number.intValue();
    }
    if (raw instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        return fallback;
      }
    }
    return fallback;
  }
}
