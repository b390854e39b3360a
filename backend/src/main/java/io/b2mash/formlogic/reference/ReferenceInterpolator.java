package io.b2mash.formlogic.reference;

import io.b2mash.formlogic.condition.ValueNormalizer;
import io.b2mash.formlogic.structure.FieldType;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders free text that refers to other fields with {@code @name} tokens, replacing each bound
 * reference with the referenced field's current answer. Tokens that do not bind to a known field
 * are left as written.
 */
@Component
public class ReferenceInterpolator {

  public String interpolate(
      String text, Collection<ReferenceField> fields, Map<String, Object> answers) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    var matches = ReferenceScanner.of(fields).scanNames(text);
    if (matches.isEmpty()) {
      return text;
    }
    var rendered = new StringBuilder(text.length());
    int cursor = 0;
    for (var match : matches) {
      rendered.append(text, cursor, match.start());
      rendered.append(format(match.field(), answers.get(match.field().name())));
      cursor = match.end();
    }
    rendered.append(text, cursor, text.length());
    return rendered.toString();
  }

  /** Empty answers render as nothing; boolean fields as Yes/No; lists comma-separated. */
  String format(ReferenceField field, Object value) {
    if (ValueNormalizer.isEmpty(value)) {
      return "";
    }
    if (field.fieldType() == FieldType.BOOLEAN || value instanceof Boolean) {
      return "true".equals(String.valueOf(value).trim().toLowerCase(Locale.ROOT)) ? "Yes" : "No";
    }
    return ValueNormalizer.toDisplayString(value);
  }
}
