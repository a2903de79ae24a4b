package com.codeheadsystems.memorystore.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class ConditionExpressionEvaluatorTest {

  private static final Map<String, AttributeValue> ITEM = Map.of(
      "id", AttributeValue.builder().s("p-1").build(),
      "name", AttributeValue.builder().s("Super Widget").build(),
      "price", AttributeValue.builder().n("19.99").build(),
      "version", AttributeValue.builder().n("3").build(),
      "tags", AttributeValue.builder().l(AttributeValue.builder().s("blue").build()).build()
  );

  private ConditionExpressionEvaluator evaluator;

  @BeforeEach
  void setup() {
    evaluator = new ConditionExpressionEvaluator();
  }

  @Test
  void evaluate_blankExpression_isTrue() {
    assertThat(evaluator.evaluate(ITEM, " ", null, null)).isTrue();
    assertThat(evaluator.evaluate(null, null, null, null)).isTrue();
  }

  @Test
  void evaluate_attributeNotExists_trueWhenItemIsNull() {
    assertThat(evaluator.evaluate(null, "attribute_not_exists(#id)", Map.of(), Map.of("#id", "id"))).isTrue();
    assertThat(evaluator.evaluate(ITEM, "attribute_not_exists(#id)", Map.of(), Map.of("#id", "id"))).isFalse();
  }

  @Test
  void evaluate_attributeExists() {
    assertThat(evaluator.evaluate(ITEM, "attribute_exists(name)", Map.of(), null)).isTrue();
    assertThat(evaluator.evaluate(null, "attribute_exists(name)", Map.of(), null)).isFalse();
  }

  @Test
  void evaluate_numericEquality_comparesByValue() {
    final Map<String, AttributeValue> values = Map.of(":v", AttributeValue.builder().n("3.0").build());

    assertThat(evaluator.evaluate(ITEM, "#version = :v", values, Map.of("#version", "version"))).isTrue();
  }

  @Test
  void evaluate_comparisons() {
    final Map<String, AttributeValue> values = Map.of(":p", AttributeValue.builder().n("20").build());

    assertThat(evaluator.evaluate(ITEM, "price < :p", values, null)).isTrue();
    assertThat(evaluator.evaluate(ITEM, "price >= :p", values, null)).isFalse();
    assertThat(evaluator.evaluate(ITEM, "price <> :p", values, null)).isTrue();
  }

  @Test
  void evaluate_containsAndBeginsWith() {
    final Map<String, AttributeValue> values = Map.of(
        ":w", AttributeValue.builder().s("Widget").build(),
        ":s", AttributeValue.builder().s("Super").build(),
        ":t", AttributeValue.builder().s("blue").build());
    final Map<String, String> names = Map.of("#name", "name");

    assertThat(evaluator.evaluate(ITEM, "contains(#name, :w)", values, names)).isTrue();
    assertThat(evaluator.evaluate(ITEM, "begins_with(#name, :s)", values, names)).isTrue();
    assertThat(evaluator.evaluate(ITEM, "begins_with(#name, :w)", values, names)).isFalse();
    assertThat(evaluator.evaluate(ITEM, "contains(tags, :t)", values, names)).isTrue();
  }

  @Test
  void evaluate_between_andConjunction() {
    final Map<String, AttributeValue> values = Map.of(
        ":low", AttributeValue.builder().n("10").build(),
        ":high", AttributeValue.builder().n("20").build(),
        ":id", AttributeValue.builder().s("p-1").build());

    assertThat(evaluator.evaluate(ITEM, "price BETWEEN :low AND :high AND id = :id", values, null)).isTrue();
  }

  @Test
  void evaluate_orNotAndParentheses() {
    final Map<String, AttributeValue> values = Map.of(
        ":a", AttributeValue.builder().s("nope").build(),
        ":b", AttributeValue.builder().s("p-1").build());

    assertThat(evaluator.evaluate(ITEM, "(id = :a OR id = :b) AND NOT id = :a", values, null)).isTrue();
    assertThat(evaluator.evaluate(ITEM, "NOT (id = :a OR id = :b)", values, null)).isFalse();
  }

  @Test
  void evaluate_undefinedPlaceholder_throws() {
    assertThatThrownBy(() -> evaluator.evaluate(ITEM, "#missing = :v", Map.of(), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
