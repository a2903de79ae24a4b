package com.codeheadsystems.entitystore.converter;

import com.codeheadsystems.entitystore.exception.EncodingException;
import java.math.BigDecimal;
import java.math.BigInteger;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Turns loosely typed expression values into attribute values. Numbers are written as N, null
 * as NULL, attribute values pass through and everything else is written as its string form.
 * NaN and infinite numbers are rejected with an {@link EncodingException}.
 */
public final class ValueCoercion {

  private ValueCoercion() {
  }

  /**
   * Coerce a value.
   *
   * @param value the value
   * @return the attribute value
   */
  public static AttributeValue coerce(final Object value) {
    if (value == null) {
      return AttributeValue.builder().nul(true).build();
    }
    if (value instanceof AttributeValue) {
      return (AttributeValue) value;
    }
    if (value instanceof Number) {
      return AttributeValue.builder().n(numberText((Number) value)).build();
    }
    return AttributeValue.builder().s(String.valueOf(value)).build();
  }

  private static String numberText(final Number number) {
    if (number instanceof BigDecimal) {
      return ((BigDecimal) number).toPlainString();
    }
    if (number instanceof BigInteger || number instanceof Long || number instanceof Integer
        || number instanceof Short || number instanceof Byte) {
      return number.toString();
    }
    final double value = number.doubleValue();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new EncodingException("Number has no decimal representation: " + value);
    }
    return BigDecimal.valueOf(value).toPlainString();
  }
}
