package com.codeheadsystems.entitystore.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.entitystore.exception.EncodingException;
import com.codeheadsystems.entitystore.model.Note;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class KeyBuilderTest {

  private KeyBuilder keyBuilder;

  @BeforeEach
  void setup() {
    keyBuilder = new KeyBuilder(new AttributeValueConverter(new ObjectMapper()));
  }

  @Test
  void simpleKey() {
    assertThat(keyBuilder.simpleKey("p1")).containsExactly(Map.entry("id", AttributeValue.builder().s("p1").build()));
  }

  @Test
  void keyFor_usesEntityId() {
    assertThat(keyBuilder.keyFor(new Note("n1", "hi"))).isEqualTo(keyBuilder.simpleKey("n1"));
  }

  @Test
  void compositeKey() {
    final Map<String, AttributeValue> key = keyBuilder.compositeKey("customerId", "orderNumber", "c1", 42);

    assertThat(key).containsOnlyKeys("customerId", "orderNumber");
    assertThat(key.get("customerId").s()).isEqualTo("c1");
    assertThat(key.get("orderNumber").n()).isEqualTo("42");
  }

  @Test
  void compositeKey_nonScalar_throwsEncoding() {
    assertThatThrownBy(() -> keyBuilder.compositeKey("a", "b", "c1", Map.of("x", 1)))
        .isInstanceOf(EncodingException.class);
  }

  @Test
  void simpleKey_null_throwsEncoding() {
    assertThatThrownBy(() -> keyBuilder.simpleKey(null)).isInstanceOf(EncodingException.class);
  }
}
