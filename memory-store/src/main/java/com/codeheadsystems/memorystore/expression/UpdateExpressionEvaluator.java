package com.codeheadsystems.memorystore.expression;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Applies SET and REMOVE update expressions to an item. SET supports plain assignment and
 * numeric addition of the form {@code #a = #a + :v}.
 */
@Singleton
public class UpdateExpressionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(UpdateExpressionEvaluator.class);

  private static final Pattern SET_PATTERN = Pattern.compile(
      "SET\\s+(.+?)(?=\\s+REMOVE\\s|$)", Pattern.CASE_INSENSITIVE);
  private static final Pattern REMOVE_PATTERN = Pattern.compile(
      "REMOVE\\s+(.+?)(?=\\s+SET\\s|$)", Pattern.CASE_INSENSITIVE);
  private static final Pattern ASSIGNMENT = Pattern.compile(
      "(#?\\w+)\\s*=\\s*(.+?)(?=\\s*,\\s*#?\\w+\\s*=|$)");
  private static final Pattern ADDITION = Pattern.compile("(#?\\w+)\\s*\\+\\s*(:\\w+)");

  private final ConditionExpressionEvaluator conditionExpressionEvaluator;

  /**
   * Instantiates a new Update expression evaluator.
   *
   * @param conditionExpressionEvaluator used for name resolution
   */
  @Inject
  public UpdateExpressionEvaluator(final ConditionExpressionEvaluator conditionExpressionEvaluator) {
    log.info("UpdateExpressionEvaluator({})", conditionExpressionEvaluator);
    this.conditionExpressionEvaluator = conditionExpressionEvaluator;
  }

  /**
   * Applies the update expression to a copy of the item.
   *
   * @param item       the current item, may be empty for an upsert
   * @param expression the update expression
   * @param values     the expression attribute values
   * @param names      the expression attribute names
   * @return the updated copy
   */
  public Map<String, AttributeValue> apply(final Map<String, AttributeValue> item,
                                           final String expression,
                                           final Map<String, AttributeValue> values,
                                           final Map<String, String> names) {
    log.trace("apply({}, {}, {}, {})", item, expression, values, names);
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("Update expression cannot be empty");
    }
    final Map<String, AttributeValue> safeValues = values == null ? Map.of() : values;
    final Map<String, String> safeNames = names == null ? Map.of() : names;
    final Map<String, AttributeValue> result = new HashMap<>(item);

    final Matcher set = SET_PATTERN.matcher(expression.trim());
    if (set.find()) {
      final Matcher assignment = ASSIGNMENT.matcher(set.group(1).trim());
      while (assignment.find()) {
        final String name = conditionExpressionEvaluator.resolveName(assignment.group(1).trim(), safeNames);
        result.put(name, evaluateValue(result, assignment.group(2).trim(), safeValues, safeNames));
      }
    }
    final Matcher remove = REMOVE_PATTERN.matcher(expression.trim());
    if (remove.find()) {
      for (String token : remove.group(1).split(",")) {
        result.remove(conditionExpressionEvaluator.resolveName(token.trim(), safeNames));
      }
    }
    return result;
  }

  private AttributeValue evaluateValue(final Map<String, AttributeValue> item,
                                       final String operand,
                                       final Map<String, AttributeValue> values,
                                       final Map<String, String> names) {
    final Matcher addition = ADDITION.matcher(operand);
    if (addition.matches()) {
      final String name = conditionExpressionEvaluator.resolveName(addition.group(1), names);
      final AttributeValue current = item.get(name);
      final AttributeValue increment = placeholder(addition.group(2), values);
      if (current == null || current.n() == null || increment.n() == null) {
        throw new IllegalArgumentException("Numeric addition needs numeric operands: " + operand);
      }
      final BigDecimal sum = new BigDecimal(current.n()).add(new BigDecimal(increment.n()));
      return AttributeValue.builder().n(sum.toPlainString()).build();
    }
    return placeholder(operand, values);
  }

  private AttributeValue placeholder(final String token, final Map<String, AttributeValue> values) {
    if (!token.startsWith(":")) {
      throw new IllegalArgumentException("Invalid value expression (must start with :): " + token);
    }
    final AttributeValue value = values.get(token);
    if (value == null) {
      throw new IllegalArgumentException("Expression attribute value not defined: " + token);
    }
    return value;
  }
}
