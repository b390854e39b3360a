package io.b2mash.formlogic.reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds field references in free text. Interpolation, highlighting and the token codec all go
 * through this class so they agree on where a reference starts and ends.
 *
 * <p>A name reference is {@code @} followed by the longest known field name (compared
 * case-insensitively) that fits before the next hard delimiter: whitespace, another {@code @} or
 * the end of the text. Anything after the bound name, such as punctuation, stays plain text. An id
 * reference is {@code @#} followed by a run of digits; the whole run must equal a known field id.
 */
public final class ReferenceScanner {

  private static final char MARKER = '@';
  private static final char ID_MARKER = '#';
  private static final int MAX_ID_DIGITS = 18;

  private final List<ReferenceField> byNameLength;
  private final Map<Long, ReferenceField> byId;

  private ReferenceScanner(Collection<ReferenceField> fields) {
    this.byNameLength =
        fields.stream()
            .filter(f -> f.name() != null && !f.name().isEmpty())
            .sorted(Comparator.comparingInt((ReferenceField f) -> f.name().length()).reversed())
            .toList();
    this.byId =
        fields.stream()
            .collect(
                Collectors.toMap(
                    ReferenceField::id, Function.identity(), (first, second) -> first));
  }

  public static ReferenceScanner of(Collection<ReferenceField> fields) {
    return new ReferenceScanner(fields);
  }

  /** Name references in {@code text}, left to right and non-overlapping. */
  public List<ReferenceMatch> scanNames(String text) {
    var matches = new ArrayList<ReferenceMatch>();
    if (text == null || text.isEmpty()) {
      return matches;
    }
    int i = 0;
    while (i < text.length()) {
      if (text.charAt(i) != MARKER) {
        i++;
        continue;
      }
      int runLength = delimitedRunLength(text, i + 1);
      ReferenceField bound = null;
      for (var field : byNameLength) {
        String name = field.name();
        if (name.length() <= runLength && text.regionMatches(true, i + 1, name, 0, name.length())) {
          bound = field;
          break;
        }
      }
      if (bound == null) {
        i++;
        continue;
      }
      int end = i + 1 + bound.name().length();
      matches.add(new ReferenceMatch(i, end, bound));
      i = end;
    }
    return matches;
  }

  /** Id references ({@code @#<id>}) in {@code text}, left to right and non-overlapping. */
  public List<ReferenceMatch> scanIds(String text) {
    var matches = new ArrayList<ReferenceMatch>();
    if (text == null || text.isEmpty()) {
      return matches;
    }
    int i = 0;
    while (i < text.length()) {
      if (text.charAt(i) != MARKER || i + 1 >= text.length() || text.charAt(i + 1) != ID_MARKER) {
        i++;
        continue;
      }
      String digits = digitRun(text, i + 2);
      ReferenceField bound =
          digits.isEmpty() || digits.length() > MAX_ID_DIGITS
              ? null
              : byId.get(Long.parseLong(digits));
      if (bound == null) {
        i += 2 + digits.length();
        continue;
      }
      int end = i + 2 + digits.length();
      matches.add(new ReferenceMatch(i, end, bound));
      i = end;
    }
    return matches;
  }

  private static int delimitedRunLength(String text, int from) {
    int end = from;
    while (end < text.length()
        && text.charAt(end) != MARKER
        && !Character.isWhitespace(text.charAt(end))) {
      end++;
    }
    return end - from;
  }

  private static String digitRun(String text, int from) {
    int end = from;
    while (end < text.length() && Character.isDigit(text.charAt(end))) {
      end++;
    }
    return text.substring(from, end);
  }
}
