package io.b2mash.formlogic.reference;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Converts paragraph text between its editing form ({@code @name}) and its stored form ({@code
 * @#id}). Stored text survives field renames; editing text is what authors type. References that
 * do not bind are left untouched in both directions. A name directly followed by a digit stays in
 * editing form, since its id token would run into the digit and read back as a different id.
 */
@Component
public class ReferenceTokenCodec {

  public String encode(String text, Collection<ReferenceField> fields) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    var matches =
        ReferenceScanner.of(fields).scanNames(text).stream()
            .filter(m -> m.end() >= text.length() || !Character.isDigit(text.charAt(m.end())))
            .toList();
    return rewrite(text, matches, f -> "@#" + f.id());
  }

  public String decode(String text, Collection<ReferenceField> fields) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    return rewrite(text, ReferenceScanner.of(fields).scanIds(text), f -> "@" + f.name());
  }

  private static String rewrite(
      String text, List<ReferenceMatch> matches, Function<ReferenceField, String> token) {
    if (matches.isEmpty()) {
      return text;
    }
    var out = new StringBuilder(text.length());
    int cursor = 0;
    for (var match : matches) {
      out.append(text, cursor, match.start()).append(token.apply(match.field()));
      cursor = match.end();
    }
    out.append(text, cursor, text.length());
    return out.toString();
  }
}
