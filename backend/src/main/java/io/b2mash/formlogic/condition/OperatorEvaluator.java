package io.b2mash.formlogic.condition;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Evaluates one comparison operator against a field's current value and an optional literal.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>{@code null} operator (unknown name) = false
 *   <li>{@code is_empty}/{@code is_not_empty} ignore the literal
 *   <li>Any other operator against an absent ({@code null}) value = false
 *   <li>String operators are case-insensitive
 *   <li>Numeric operators need both sides numeric, otherwise false
 *   <li>List values: {@code contains}, {@code in} and their negations work element-wise
 * </ul>
 *
 * <p>Stateless; never throws for any combination of inputs.
 */
@Component
public class OperatorEvaluator {

  public boolean evaluate(ConditionOperator operator, Object fieldValue, String literal) {
    if (operator == null) {
      return false;
    }
    if (operator == ConditionOperator.IS_EMPTY) {
      return ValueNormalizer.isEmpty(fieldValue);
    }
    if (operator == ConditionOperator.IS_NOT_EMPTY) {
      return !ValueNormalizer.isEmpty(fieldValue);
    }
    if (fieldValue == null) {
      return false;
    }
    if (operator.isNumeric()) {
      return compareNumbers(operator, fieldValue, literal);
    }

    String expected = literal != null ? literal.toLowerCase(Locale.ROOT) : "";
    return switch (operator) {
      case EQUALS -> ValueNormalizer.toComparableString(fieldValue).equals(expected);
      case NOT_EQUALS -> !ValueNormalizer.toComparableString(fieldValue).equals(expected);
      case CONTAINS -> !expected.isEmpty() && containsLiteral(fieldValue, expected);
      case NOT_CONTAINS -> !expected.isEmpty() && !containsLiteral(fieldValue, expected);
      case IN -> !expected.isBlank() && anyElementIn(fieldValue, tokens(expected));
      case NOT_IN -> expected.isBlank() || !anyElementIn(fieldValue, tokens(expected));
      default -> false;
    };
  }

  private boolean compareNumbers(ConditionOperator operator, Object fieldValue, String literal) {
    var left = ValueNormalizer.toNumber(fieldValue);
    var right = ValueNormalizer.toNumber(literal);
    if (left.isEmpty() || right.isEmpty()) {
      return false;
    }
    int cmp = left.get().compareTo(right.get());
    return switch (operator) {
      case GREATER_THAN -> cmp > 0;
      case LESS_THAN -> cmp < 0;
      case GREATER_EQUAL -> cmp >= 0;
      case LESS_EQUAL -> cmp <= 0;
      default -> false;
    };
  }

  private boolean containsLiteral(Object fieldValue, String expected) {
    if (fieldValue instanceof Collection<?>) {
      return ValueNormalizer.toComparableList(fieldValue).stream()
          .anyMatch(element -> element.contains(expected));
    }
    return ValueNormalizer.toComparableString(fieldValue).contains(expected);
  }

  private boolean anyElementIn(Object fieldValue, Set<String> tokens) {
    List<String> elements = ValueNormalizer.toComparableList(fieldValue);
    return elements.stream().anyMatch(tokens::contains);
  }

  private Set<String> tokens(String expected) {
    return Arrays.stream(expected.split(","))
        .map(String::trim)
        .map(token -> token.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }
}
