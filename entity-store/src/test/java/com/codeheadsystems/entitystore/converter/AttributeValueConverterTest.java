package com.codeheadsystems.entitystore.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.entitystore.exception.DecodingException;
import com.codeheadsystems.entitystore.exception.EncodingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class AttributeValueConverterTest {

  private ObjectMapper objectMapper;
  private AttributeValueConverter converter;

  @BeforeEach
  void setup() {
    objectMapper = new ObjectMapper();
    converter = new AttributeValueConverter(objectMapper);
  }

  @Test
  void toItem_tagsEveryType() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(
        "{\"s\":\"text\",\"i\":42,\"d\":9.99,\"b\":true,\"n\":null,\"l\":[1,\"two\"],\"m\":{\"k\":\"v\"}}");

    final Map<String, AttributeValue> item = converter.toItem(node);

    assertThat(item.get("s").s()).isEqualTo("text");
    assertThat(item.get("i").n()).isEqualTo("42");
    assertThat(item.get("d").n()).isEqualTo("9.99");
    assertThat(item.get("b").bool()).isTrue();
    assertThat(item.get("n").nul()).isTrue();
    assertThat(item.get("l").l()).containsExactly(
        AttributeValue.builder().n("1").build(),
        AttributeValue.builder().s("two").build());
    assertThat(item.get("m").m()).containsEntry("k", AttributeValue.builder().s("v").build());
  }

  @Test
  void toAttributeValue_largeAndSmallDoubles_useDecimalText() {
    assertThat(converter.toAttributeValue(objectMapper.valueToTree(1.0e20)).n()).isEqualTo("100000000000000000000");
    assertThat(converter.toAttributeValue(objectMapper.valueToTree(0.25)).n()).isEqualTo("0.25");
  }

  @Test
  void toAttributeValue_nan_throwsEncoding() {
    assertThatThrownBy(() -> converter.toAttributeValue(objectMapper.valueToTree(Double.NaN)))
        .isInstanceOf(EncodingException.class);
  }

  @Test
  void toJsonNode_numbers() {
    final JsonNode integral = converter.toJsonNode(AttributeValue.builder().n("12").build());
    final JsonNode decimal = converter.toJsonNode(AttributeValue.builder().n("1.5").build());
    final JsonNode huge = converter.toJsonNode(AttributeValue.builder().n("123456789012345678901234567890").build());

    assertThat(integral.isIntegralNumber()).isTrue();
    assertThat(integral.longValue()).isEqualTo(12L);
    assertThat(decimal.isFloatingPointNumber()).isTrue();
    assertThat(decimal.doubleValue()).isEqualTo(1.5);
    assertThat(huge.isBigInteger()).isTrue();
  }

  @Test
  void toJsonNode_numbers_narrowestExactNode() {
    assertThat(converter.toJsonNode(AttributeValue.builder().n("3").build()).isInt()).isTrue();
    assertThat(converter.toJsonNode(AttributeValue.builder().n("12345678901").build()).isLong()).isTrue();
    assertThat(converter.toJsonNode(AttributeValue.builder().n("9.99").build()).isDouble()).isTrue();
    assertThat(converter.toJsonNode(AttributeValue.builder().n("3.00").build()).isBigDecimal()).isTrue();
    assertThat(converter.toJsonNode(AttributeValue.builder().n("0.10000000000000000001").build()).isBigDecimal())
        .isTrue();
  }

  @Test
  void toJsonNode_sets() {
    final JsonNode strings = converter.toJsonNode(AttributeValue.builder().ss("a", "b").build());
    final JsonNode numbers = converter.toJsonNode(AttributeValue.builder().ns("1", "2").build());

    assertThat(strings.isArray()).isTrue();
    assertThat(strings).hasSize(2);
    assertThat(numbers.get(0).isNumber()).isTrue();
  }

  @Test
  void toJsonNode_invalidNumber_throwsDecoding() {
    assertThatThrownBy(() -> converter.toJsonNode(AttributeValue.builder().n("twelve").build()))
        .isInstanceOf(DecodingException.class);
  }

  @Test
  void toScalar_rejectsNonScalars() {
    assertThat(converter.toScalar("x").s()).isEqualTo("x");
    assertThat(converter.toScalar(7).n()).isEqualTo("7");
    assertThatThrownBy(() -> converter.toScalar(List.of("x")))
        .isInstanceOf(EncodingException.class);
    assertThatThrownBy(() -> converter.toScalar(true))
        .isInstanceOf(EncodingException.class);
  }
}
