package com.codeheadsystems.entitystore.expression;

import com.codeheadsystems.entitystore.converter.ValueCoercion;
import com.codeheadsystems.entitystore.model.ImmutableScanSpec;
import com.codeheadsystems.entitystore.model.ScanSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Fluent builder for filter and projection expressions. Every attribute goes through a #name
 * placeholder so reserved words such as name and status are safe, and conditions are joined
 * with AND.
 */
public class ExpressionBuilder {

  private final List<String> conditions = new ArrayList<>();
  private final List<String> projections = new ArrayList<>();
  private final Map<String, String> names = new LinkedHashMap<>();
  private final Map<String, AttributeValue> values = new LinkedHashMap<>();

  /**
   * Starts a new builder.
   *
   * @return the builder
   */
  public static ExpressionBuilder builder() {
    return new ExpressionBuilder();
  }

  /**
   * attribute = value.
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this
   */
  public ExpressionBuilder equalTo(final String attribute, final Object value) {
    conditions.add(name(attribute) + " = " + value(value));
    return this;
  }

  /**
   * contains(attribute, value).
   *
   * @param attribute the attribute
   * @param value     the value
   * @return this
   */
  public ExpressionBuilder contains(final String attribute, final Object value) {
    conditions.add("contains(" + name(attribute) + ", " + value(value) + ")");
    return this;
  }

  /**
   * begins_with(attribute, prefix).
   *
   * @param attribute the attribute
   * @param prefix    the prefix
   * @return this
   */
  public ExpressionBuilder beginsWith(final String attribute, final String prefix) {
    conditions.add("begins_with(" + name(attribute) + ", " + value(prefix) + ")");
    return this;
  }

  /**
   * Restrict the returned attributes.
   *
   * @param attributes the attributes
   * @return this
   */
  public ExpressionBuilder project(final String... attributes) {
    for (String attribute : attributes) {
      projections.add(name(attribute));
    }
    return this;
  }

  /**
   * The filter expression, if any condition was added.
   *
   * @return the filter
   */
  public String filterExpression() {
    return conditions.isEmpty() ? null : String.join(" AND ", conditions);
  }

  /**
   * The projection expression, if any attribute was projected.
   *
   * @return the projection
   */
  public String projectionExpression() {
    return projections.isEmpty() ? null : String.join(", ", projections);
  }

  /**
   * Placeholder names collected so far.
   *
   * @return the names
   */
  public Map<String, String> names() {
    return Map.copyOf(names);
  }

  /**
   * Placeholder values collected so far.
   *
   * @return the values
   */
  public Map<String, AttributeValue> values() {
    return Map.copyOf(values);
  }

  /**
   * A scan spec builder carrying the filter, projection and placeholders.
   *
   * @return the scan spec builder
   */
  public ImmutableScanSpec.Builder toScanSpec() {
    final ImmutableScanSpec.Builder builder = ImmutableScanSpec.builder()
        .expressionAttributeNames(names)
        .expressionAttributeValues(values);
    if (!conditions.isEmpty()) {
      builder.filterExpression(filterExpression());
    }
    if (!projections.isEmpty()) {
      builder.projectionExpression(projectionExpression());
    }
    return builder;
  }

  /**
   * The scan spec for this builder.
   *
   * @return the scan spec
   */
  public ScanSpec buildScanSpec() {
    return toScanSpec().build();
  }

  private String name(final String attribute) {
    for (Map.Entry<String, String> entry : names.entrySet()) {
      if (entry.getValue().equals(attribute)) {
        return entry.getKey();
      }
    }
    final String placeholder = "#n" + names.size();
    names.put(placeholder, attribute);
    return placeholder;
  }

  private String value(final Object value) {
    final String placeholder = ":v" + values.size();
    values.put(placeholder, ValueCoercion.coerce(value));
    return placeholder;
  }
}
