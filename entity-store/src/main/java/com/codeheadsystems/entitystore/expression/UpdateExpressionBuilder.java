package com.codeheadsystems.entitystore.expression;

import com.codeheadsystems.entitystore.converter.ValueCoercion;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Builds SET-only update expressions. Attributes are assigned in name order through #aN/:aN
 * placeholders, and the placeholders of a condition can be merged in.
 */
@Singleton
public class UpdateExpressionBuilder {

  private static final Logger log = LoggerFactory.getLogger(UpdateExpressionBuilder.class);

  /**
   * Instantiates a new Update expression builder.
   */
  @Inject
  public UpdateExpressionBuilder() {
    log.info("UpdateExpressionBuilder()");
  }

  /**
   * Build the update expression.
   *
   * @param assignments     attribute name to value
   * @param conditionNames  names used by a condition, merged into the result
   * @param conditionValues values used by a condition, merged into the result
   * @return the expression
   */
  public Expression build(final Map<String, Object> assignments,
                          final Map<String, String> conditionNames,
                          final Map<String, AttributeValue> conditionValues) {
    log.trace("build({}, {}, {})", assignments, conditionNames, conditionValues);
    if (assignments == null || assignments.isEmpty()) {
      throw new IllegalArgumentException("An update needs at least one assignment");
    }
    final Map<String, String> names = new HashMap<>();
    final Map<String, AttributeValue> values = new HashMap<>();
    final List<String> clauses = new ArrayList<>();
    int index = 0;
    for (Map.Entry<String, Object> entry : new TreeMap<>(assignments).entrySet()) {
      final String name = "#a" + index;
      final String value = ":a" + index;
      names.put(name, entry.getKey());
      values.put(value, ValueCoercion.coerce(entry.getValue()));
      clauses.add(name + " = " + value);
      index++;
    }
    merge(names, conditionNames);
    merge(values, conditionValues);
    return ImmutableExpression.builder()
        .expression("SET " + String.join(", ", clauses))
        .names(names)
        .values(values)
        .build();
  }

  private <V> void merge(final Map<String, V> target, final Map<String, V> source) {
    if (source == null) {
      return;
    }
    source.forEach((key, value) -> {
      if (target.containsKey(key)) {
        throw new IllegalArgumentException("Condition placeholder clashes with an assignment: " + key);
      }
      target.put(key, value);
    });
  }
}
