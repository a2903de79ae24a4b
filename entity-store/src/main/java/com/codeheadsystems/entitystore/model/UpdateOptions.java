package com.codeheadsystems.entitystore.model;

import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Attribute assignments of an update and the condition guarding it. Numbers are written as
 * numbers, every other value as its string form.
 */
@Value.Immutable
public interface UpdateOptions {

  /**
   * Attribute name to new value.
   *
   * @return the assignments
   */
  Map<String, Object> assignments();

  /**
   * Condition that must hold on the stored item.
   *
   * @return the condition expression
   */
  Optional<String> conditionExpression();

  /**
   * Names used by the condition.
   *
   * @return the names
   */
  Map<String, String> expressionAttributeNames();

  /**
   * Values used by the condition.
   *
   * @return the values
   */
  Map<String, AttributeValue> expressionAttributeValues();

  /**
   * Whether the updated entity is read back.
   *
   * @return the flag
   */
  @Value.Default
  default boolean returnUpdated() {
    return false;
  }

}
