package com.codeheadsystems.memorystore.expression;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Evaluates condition, filter and key condition expressions against a single item.
 * Supports comparisons, BETWEEN, AND/OR/NOT, parentheses and the functions attribute_exists,
 * attribute_not_exists, begins_with and contains.
 */
@Singleton
public class ConditionExpressionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(ConditionExpressionEvaluator.class);

  private static final Pattern OR_PATTERN = Pattern.compile("\\s+(?i)or\\s+");
  private static final Pattern AND_PATTERN = Pattern.compile("\\s+(?i)and\\s+");

  private static final Pattern ATTRIBUTE_EXISTS = Pattern.compile(
      "attribute_exists\\s*\\(\\s*(#?\\w+)\\s*\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern ATTRIBUTE_NOT_EXISTS = Pattern.compile(
      "attribute_not_exists\\s*\\(\\s*(#?\\w+)\\s*\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern BEGINS_WITH = Pattern.compile(
      "begins_with\\s*\\(\\s*(#?\\w+)\\s*,\\s*(:\\w+)\\s*\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern CONTAINS = Pattern.compile(
      "contains\\s*\\(\\s*(#?\\w+)\\s*,\\s*(:\\w+)\\s*\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern BETWEEN = Pattern.compile(
      "(#?\\w+)\\s+BETWEEN\\s+(:\\w+)\\s+AND\\s+(:\\w+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern COMPARISON = Pattern.compile(
      "(#?\\w+)\\s*(<=|>=|<>|=|<|>)\\s*(:\\w+)");

  /**
   * Instantiates a new Condition expression evaluator.
   */
  @Inject
  public ConditionExpressionEvaluator() {
    log.info("ConditionExpressionEvaluator()");
  }

  /**
   * Evaluates an expression against an item.
   *
   * @param item       the item, null when no item exists for the key
   * @param expression the expression, blank means always true
   * @param values     the expression attribute values
   * @param names      the expression attribute names
   * @return true if the expression holds
   */
  public boolean evaluate(final Map<String, AttributeValue> item,
                          final String expression,
                          final Map<String, AttributeValue> values,
                          final Map<String, String> names) {
    log.trace("evaluate({}, {}, {}, {})", item, expression, values, names);
    if (expression == null || expression.isBlank()) {
      return true;
    }
    return evaluateClause(item, expression.trim(), values == null ? Map.of() : values, names == null ? Map.of() : names);
  }

  /**
   * Resolves a #placeholder to its attribute name. Plain names are returned unchanged.
   *
   * @param token the token
   * @param names the expression attribute names
   * @return the attribute name
   */
  public String resolveName(final String token, final Map<String, String> names) {
    if (!token.startsWith("#")) {
      return token;
    }
    final String resolved = names == null ? null : names.get(token);
    if (resolved == null) {
      throw new IllegalArgumentException("Expression attribute name not defined: " + token);
    }
    return resolved;
  }

  /**
   * Orders two scalar values. Numbers compare numerically, strings and binaries lexically.
   *
   * @param left  the left value
   * @param right the right value
   * @return the ordering, empty when the values are not comparable
   */
  public Optional<Integer> compare(final AttributeValue left, final AttributeValue right) {
    if (left.s() != null && right.s() != null) {
      return Optional.of(left.s().compareTo(right.s()));
    }
    if (left.n() != null && right.n() != null) {
      return Optional.of(new BigDecimal(left.n()).compareTo(new BigDecimal(right.n())));
    }
    if (left.b() != null && right.b() != null) {
      return Optional.of(left.b().asByteBuffer().compareTo(right.b().asByteBuffer()));
    }
    return Optional.empty();
  }

  private boolean evaluateClause(final Map<String, AttributeValue> item,
                                 final String clause,
                                 final Map<String, AttributeValue> values,
                                 final Map<String, String> names) {
    final String trimmed = clause.trim();
    if (wrappedInParentheses(trimmed)) {
      return evaluateClause(item, trimmed.substring(1, trimmed.length() - 1), values, names);
    }
    final Optional<int[]> or = topLevelSplit(trimmed, OR_PATTERN);
    if (or.isPresent()) {
      return evaluateClause(item, trimmed.substring(0, or.get()[0]), values, names)
          || evaluateClause(item, trimmed.substring(or.get()[1]), values, names);
    }
    final Optional<int[]> and = topLevelSplit(trimmed, AND_PATTERN);
    if (and.isPresent()) {
      return evaluateClause(item, trimmed.substring(0, and.get()[0]), values, names)
          && evaluateClause(item, trimmed.substring(and.get()[1]), values, names);
    }
    if (trimmed.regionMatches(true, 0, "NOT ", 0, 4)) {
      return !evaluateClause(item, trimmed.substring(4), values, names);
    }
    return evaluateAtom(item, trimmed, values, names);
  }

  /**
   * Finds the first operator occurrence that sits at parenthesis depth zero and is not the
   * AND of a BETWEEN.
   */
  private Optional<int[]> topLevelSplit(final String clause, final Pattern operator) {
    final Matcher matcher = operator.matcher(clause);
    while (matcher.find()) {
      final String before = clause.substring(0, matcher.start());
      if (depth(before) == 0 && !insideBetween(before)) {
        return Optional.of(new int[]{matcher.start(), matcher.end()});
      }
    }
    return Optional.empty();
  }

  private int depth(final String text) {
    int depth = 0;
    for (char c : text.toCharArray()) {
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      }
    }
    return depth;
  }

  private boolean insideBetween(final String before) {
    final String upper = before.toUpperCase();
    final int between = upper.lastIndexOf(" BETWEEN ");
    return between >= 0 && !upper.substring(between + 9).contains(" AND ");
  }

  private boolean wrappedInParentheses(final String expression) {
    if (!expression.startsWith("(") || !expression.endsWith(")")) {
      return false;
    }
    int depth = 0;
    for (int i = 0; i < expression.length(); i++) {
      final char c = expression.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0 && i < expression.length() - 1) {
          return false;
        }
      }
    }
    return true;
  }

  private boolean evaluateAtom(final Map<String, AttributeValue> item,
                               final String atom,
                               final Map<String, AttributeValue> values,
                               final Map<String, String> names) {
    Matcher matcher = ATTRIBUTE_EXISTS.matcher(atom);
    if (matcher.matches()) {
      return item != null && item.containsKey(resolveName(matcher.group(1), names));
    }
    matcher = ATTRIBUTE_NOT_EXISTS.matcher(atom);
    if (matcher.matches()) {
      return item == null || !item.containsKey(resolveName(matcher.group(1), names));
    }
    matcher = BEGINS_WITH.matcher(atom);
    if (matcher.matches()) {
      final AttributeValue actual = attribute(item, matcher.group(1), names);
      final AttributeValue prefix = value(values, matcher.group(2));
      return actual != null && actual.s() != null && prefix.s() != null && actual.s().startsWith(prefix.s());
    }
    matcher = CONTAINS.matcher(atom);
    if (matcher.matches()) {
      final AttributeValue actual = attribute(item, matcher.group(1), names);
      return actual != null && contains(actual, value(values, matcher.group(2)));
    }
    matcher = BETWEEN.matcher(atom);
    if (matcher.matches()) {
      final AttributeValue actual = attribute(item, matcher.group(1), names);
      if (actual == null) {
        return false;
      }
      final Optional<Integer> low = compare(actual, value(values, matcher.group(2)));
      final Optional<Integer> high = compare(actual, value(values, matcher.group(3)));
      return low.isPresent() && high.isPresent() && low.get() >= 0 && high.get() <= 0;
    }
    matcher = COMPARISON.matcher(atom);
    if (matcher.matches()) {
      final AttributeValue actual = attribute(item, matcher.group(1), names);
      if (actual == null) {
        return false;
      }
      final AttributeValue expected = value(values, matcher.group(3));
      final String operator = matcher.group(2);
      if (operator.equals("=")) {
        return actual.equals(expected) || compare(actual, expected).map(c -> c == 0).orElse(false);
      }
      if (operator.equals("<>")) {
        return !actual.equals(expected) && compare(actual, expected).map(c -> c != 0).orElse(true);
      }
      return compare(actual, expected).map(c -> switch (operator) {
        case "<" -> c < 0;
        case "<=" -> c <= 0;
        case ">" -> c > 0;
        case ">=" -> c >= 0;
        default -> false;
      }).orElse(false);
    }
    throw new IllegalArgumentException("Unsupported expression: " + atom);
  }

  private boolean contains(final AttributeValue actual, final AttributeValue operand) {
    if (actual.s() != null) {
      return operand.s() != null && actual.s().contains(operand.s());
    }
    if (actual.hasL()) {
      return actual.l().stream().anyMatch(element -> element.equals(operand));
    }
    if (actual.hasSs()) {
      return operand.s() != null && actual.ss().contains(operand.s());
    }
    if (actual.hasNs()) {
      return operand.n() != null && actual.ns().contains(operand.n());
    }
    return false;
  }

  private AttributeValue attribute(final Map<String, AttributeValue> item,
                                   final String token,
                                   final Map<String, String> names) {
    return item == null ? null : item.get(resolveName(token, names));
  }

  private AttributeValue value(final Map<String, AttributeValue> values, final String placeholder) {
    final AttributeValue value = values.get(placeholder);
    if (value == null) {
      throw new IllegalArgumentException("Expression attribute value not defined: " + placeholder);
    }
    return value;
  }
}
