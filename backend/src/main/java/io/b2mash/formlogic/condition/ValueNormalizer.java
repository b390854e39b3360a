package io.b2mash.formlogic.condition;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes raw answer values before comparison. Answers arrive as whatever the JSON layer
 * produced: strings, numbers, booleans, lists (checkbox and multiselect fields) or nothing at all.
 *
 * <p>Normalization never throws. A value that cannot take the requested form (a non-numeric string
 * asked for as a number) comes back empty and the caller treats it as a non-match.
 */
public final class ValueNormalizer {

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private ValueNormalizer() {}

  /** {@code null}, the empty string and an empty collection are all empty. */
  public static boolean isEmpty(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence text) {
      return text.length() == 0;
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    return false;
  }

  /**
   * Lower-cased string form used by the string operators. Lists collapse to their comma-joined
   * elements, numbers to their canonical decimal form.
   */
  public static String toComparableString(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Collection<?> collection) {
      return collection.stream()
          .map(ValueNormalizer::toComparableString)
          .collect(Collectors.joining(","));
    }
    return toPlainString(value).toLowerCase(Locale.ROOT);
  }

  /** Element-wise lower-cased strings; a scalar becomes a one-element list. */
  public static List<String> toComparableList(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(ValueNormalizer::toComparableString).toList();
    }
    return List.of(toComparableString(value));
  }

  /**
   * Strict numeric parse. Accepts plain decimal notation with an optional exponent; rejects
   * booleans, lists, {@code NaN}, infinities and anything with trailing text.
   */
  public static Optional<BigDecimal> toNumber(Object value) {
    if (value instanceof BigDecimal decimal) {
      return Optional.of(decimal);
    }
    if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      return Optional.empty();
    }
    if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      return Optional.empty();
    }
    if (value instanceof Number number) {
      return parse(number.toString());
    }
    if (value instanceof CharSequence text) {
      return parse(text.toString().trim());
    }
    return Optional.empty();
  }

  /** Human-facing string form: numbers canonical, lists joined with {@code ", "}. */
  public static String toDisplayString(Object value) {
    if (isEmpty(value)) {
      return "";
    }
    if (value instanceof Collection<?> collection) {
      return collection.stream()
          .map(ValueNormalizer::toDisplayString)
          .collect(Collectors.joining(", "));
    }
    return toPlainString(value);
  }

  private static String toPlainString(Object value) {
    if (value instanceof Number number && !(value instanceof BigDecimal)) {
      return toNumber(number).map(ValueNormalizer::canonical).orElse(number.toString());
    }
    if (value instanceof BigDecimal decimal) {
      return canonical(decimal);
    }
    return String.valueOf(value);
  }

  private static String canonical(BigDecimal decimal) {
    return decimal.stripTrailingZeros().toPlainString();
  }

  private static Optional<BigDecimal> parse(String text) {
    if (!DECIMAL.matcher(text).matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new BigDecimal(text));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
