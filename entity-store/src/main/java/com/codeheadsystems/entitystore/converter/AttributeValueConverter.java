package com.codeheadsystems.entitystore.converter;

import com.codeheadsystems.entitystore.exception.DecodingException;
import com.codeheadsystems.entitystore.exception.EncodingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Converts between Jackson trees and DynamoDB attribute values. Strings become S, numbers N in
 * plain decimal text, booleans BOOL, nulls NULL, arrays L, objects M and binaries B.
 */
@Singleton
public class AttributeValueConverter {

  private static final Logger log = LoggerFactory.getLogger(AttributeValueConverter.class);

  private final ObjectMapper objectMapper;
  private final JsonNodeFactory nodeFactory;

  /**
   * Instantiates a new Attribute value converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public AttributeValueConverter(final ObjectMapper objectMapper) {
    log.info("AttributeValueConverter({})", objectMapper);
    this.objectMapper = objectMapper;
    this.nodeFactory = objectMapper.getNodeFactory();
  }

  /**
   * Converts a Jackson object to an item.
   *
   * @param node the object node
   * @return the item
   */
  public Map<String, AttributeValue> toItem(final ObjectNode node) {
    log.trace("toItem({})", node);
    final Map<String, AttributeValue> item = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      item.put(field.getKey(), toAttributeValue(field.getValue()));
    }
    return item;
  }

  /**
   * Converts a Jackson node to an attribute value.
   *
   * @param node the node
   * @return the attribute value
   */
  public AttributeValue toAttributeValue(final JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return AttributeValue.builder().nul(true).build();
    }
    if (node.isTextual()) {
      return AttributeValue.builder().s(node.textValue()).build();
    }
    if (node.isBoolean()) {
      return AttributeValue.builder().bool(node.booleanValue()).build();
    }
    if (node.isIntegralNumber()) {
      return AttributeValue.builder().n(node.bigIntegerValue().toString()).build();
    }
    if (node.isBigDecimal()) {
      return AttributeValue.builder().n(node.decimalValue().toPlainString()).build();
    }
    if (node.isFloatingPointNumber()) {
      final double value = node.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new EncodingException("Number has no decimal representation: " + value);
      }
      return AttributeValue.builder().n(BigDecimal.valueOf(value).toPlainString()).build();
    }
    if (node.isBinary()) {
      try {
        return AttributeValue.builder().b(SdkBytes.fromByteArray(node.binaryValue())).build();
      } catch (IOException e) {
        throw new EncodingException("Unreadable binary value", e);
      }
    }
    if (node.isArray()) {
      final List<AttributeValue> list = new ArrayList<>();
      node.forEach(element -> list.add(toAttributeValue(element)));
      return AttributeValue.builder().l(list).build();
    }
    if (node.isObject()) {
      return AttributeValue.builder().m(toItem((ObjectNode) node)).build();
    }
    throw new EncodingException("Unsupported value type: " + node.getNodeType());
  }

  /**
   * Converts a plain value to a scalar attribute value, for keys.
   *
   * @param value the value
   * @return the S or N attribute value
   */
  public AttributeValue toScalar(final Object value) {
    log.trace("toScalar({})", value);
    final JsonNode node;
    try {
      node = objectMapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new EncodingException("Unable to encode key value: " + value, e);
    }
    if (node == null || !(node.isTextual() || node.isNumber())) {
      throw new EncodingException("Key values must be strings or numbers: " + value);
    }
    return toAttributeValue(node);
  }

  /**
   * Converts an item to a Jackson object.
   *
   * @param item the item
   * @return the object node
   */
  public ObjectNode toObjectNode(final Map<String, AttributeValue> item) {
    log.trace("toObjectNode({})", item);
    final ObjectNode node = nodeFactory.objectNode();
    item.forEach((name, value) -> node.set(name, toJsonNode(value)));
    return node;
  }

  /**
   * Converts an attribute value to a Jackson node.
   *
   * @param value the attribute value
   * @return the node
   */
  public JsonNode toJsonNode(final AttributeValue value) {
    if (value.s() != null) {
      return nodeFactory.textNode(value.s());
    }
    if (value.n() != null) {
      return number(value.n());
    }
    if (value.bool() != null) {
      return nodeFactory.booleanNode(value.bool());
    }
    if (value.nul() != null && value.nul()) {
      return nodeFactory.nullNode();
    }
    if (value.b() != null) {
      return nodeFactory.binaryNode(value.b().asByteArray());
    }
    if (value.hasL()) {
      final ArrayNode array = nodeFactory.arrayNode();
      value.l().forEach(element -> array.add(toJsonNode(element)));
      return array;
    }
    if (value.hasM()) {
      return toObjectNode(value.m());
    }
    if (value.hasSs()) {
      final ArrayNode array = nodeFactory.arrayNode();
      value.ss().forEach(array::add);
      return array;
    }
    if (value.hasNs()) {
      final ArrayNode array = nodeFactory.arrayNode();
      value.ns().forEach(n -> array.add(number(n)));
      return array;
    }
    if (value.hasBs()) {
      final ArrayNode array = nodeFactory.arrayNode();
      value.bs().forEach(b -> array.add(b.asByteArray()));
      return array;
    }
    throw new DecodingException("Unsupported attribute value: " + value);
  }

  /**
   * Writes a key as a type-tagged Jackson object, e.g. {"id":{"S":"p1"}}.
   *
   * @param key the key
   * @return the tagged object
   */
  public ObjectNode toTagged(final Map<String, AttributeValue> key) {
    final ObjectNode node = nodeFactory.objectNode();
    key.forEach((name, value) -> {
      final ObjectNode tagged = node.putObject(name);
      if (value.s() != null) {
        tagged.put("S", value.s());
      } else if (value.n() != null) {
        tagged.put("N", value.n());
      } else if (value.b() != null) {
        tagged.put("B", value.b().asByteArray());
      } else {
        throw new EncodingException("Cursor attributes must be S, N or B: " + name);
      }
    });
    return node;
  }

  /**
   * Reads a key written by {@link #toTagged(Map)}.
   *
   * @param node the tagged object
   * @return the key
   */
  public Map<String, AttributeValue> fromTagged(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new DecodingException("Cursor must be a JSON object");
    }
    final Map<String, AttributeValue> key = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final JsonNode tagged = field.getValue();
      if (tagged.hasNonNull("S")) {
        key.put(field.getKey(), AttributeValue.builder().s(tagged.get("S").asText()).build());
      } else if (tagged.hasNonNull("N")) {
        key.put(field.getKey(), AttributeValue.builder().n(tagged.get("N").asText()).build());
      } else if (tagged.hasNonNull("B")) {
        try {
          key.put(field.getKey(), AttributeValue.builder()
              .b(SdkBytes.fromByteArray(tagged.get("B").binaryValue())).build());
        } catch (IOException e) {
          throw new DecodingException("Unreadable binary cursor attribute: " + field.getKey(), e);
        }
      } else {
        throw new DecodingException("Unsupported cursor attribute: " + field.getKey());
      }
    }
    return key;
  }

  /**
   * Picks the narrowest node that reads the number back unchanged: int, then long, then
   * BigInteger for integers; double when it writes back to the same text, else BigDecimal.
   */
  private JsonNode number(final String text) {
    try {
      if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
        final BigDecimal decimal = new BigDecimal(text);
        final double asDouble = decimal.doubleValue();
        if (!Double.isInfinite(asDouble) && BigDecimal.valueOf(asDouble).toPlainString().equals(text)) {
          return nodeFactory.numberNode(asDouble);
        }
        return nodeFactory.numberNode(decimal);
      }
      final BigInteger integer = new BigInteger(text);
      if (integer.bitLength() < 32) {
        return nodeFactory.numberNode(integer.intValue());
      }
      if (integer.bitLength() < 64) {
        return nodeFactory.numberNode(integer.longValue());
      }
      return nodeFactory.numberNode(integer);
    } catch (NumberFormatException e) {
      throw new DecodingException("Invalid number: " + text, e);
    }
  }
}
