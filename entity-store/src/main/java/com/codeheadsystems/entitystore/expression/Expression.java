package com.codeheadsystems.entitystore.expression;

import java.util.Map;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * An expression string together with the placeholders it uses.
 */
@Value.Immutable
public interface Expression {

  /**
   * Expression string.
   *
   * @return the expression
   */
  String expression();

  /**
   * Expression attribute names.
   *
   * @return the names
   */
  Map<String, String> names();

  /**
   * Expression attribute values.
   *
   * @return the values
   */
  Map<String, AttributeValue> values();

}
