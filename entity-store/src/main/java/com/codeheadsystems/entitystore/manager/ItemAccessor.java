package com.codeheadsystems.entitystore.manager;

import com.codeheadsystems.entitystore.converter.EntityCodec;
import com.codeheadsystems.entitystore.exception.ConditionFailedException;
import com.codeheadsystems.entitystore.expression.Expression;
import com.codeheadsystems.entitystore.expression.UpdateExpressionBuilder;
import com.codeheadsystems.entitystore.model.UpdateOptions;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * Single item reads and writes against one table. A failed condition surfaces as
 * {@link ConditionFailedException} and is never retried here.
 *
 * @param <T> the entity type
 */
public class ItemAccessor<T> {

  private static final Logger log = LoggerFactory.getLogger(ItemAccessor.class);

  private final DynamoDbClient dynamoDbClient;
  private final EntityCodec<T> entityCodec;
  private final UpdateExpressionBuilder updateExpressionBuilder;
  private final String tableName;

  /**
   * Instantiates a new Item accessor.
   *
   * @param dynamoDbClient          the dynamo db client
   * @param entityCodec             the entity codec
   * @param updateExpressionBuilder the update expression builder
   * @param tableName               the table name
   */
  public ItemAccessor(final DynamoDbClient dynamoDbClient,
                      final EntityCodec<T> entityCodec,
                      final UpdateExpressionBuilder updateExpressionBuilder,
                      final String tableName) {
    log.info("ItemAccessor({}, {})", entityCodec.entityClass().getSimpleName(), tableName);
    this.dynamoDbClient = dynamoDbClient;
    this.entityCodec = entityCodec;
    this.updateExpressionBuilder = updateExpressionBuilder;
    this.tableName = tableName;
  }

  /**
   * Get an item.
   *
   * @param key        the key
   * @param consistent strongly consistent read when true
   * @return the entity, empty when no item has the key
   */
  public Optional<T> get(final Map<String, AttributeValue> key, final boolean consistent) {
    log.trace("get({}, {})", key, consistent);
    final GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
        .tableName(tableName)
        .key(key)
        .consistentRead(consistent)
        .build());
    if (!response.hasItem() || response.item().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(entityCodec.unmarshal(response.item()));
  }

  /**
   * Put an entity, overwriting any item with the same key.
   *
   * @param entity the entity
   */
  public void put(final T entity) {
    put(entity, null, Map.of(), Map.of());
  }

  /**
   * Put an entity if the condition holds.
   *
   * @param entity              the entity
   * @param conditionExpression the condition, null for none
   * @param names               the expression attribute names
   * @param values              the expression attribute values
   */
  public void put(final T entity,
                  final String conditionExpression,
                  final Map<String, String> names,
                  final Map<String, AttributeValue> values) {
    log.trace("put({}, {})", entity, conditionExpression);
    final PutItemRequest.Builder builder = PutItemRequest.builder()
        .tableName(tableName)
        .item(entityCodec.marshal(entity));
    if (conditionExpression != null) {
      builder.conditionExpression(conditionExpression);
      if (!names.isEmpty()) {
        builder.expressionAttributeNames(names);
      }
      if (!values.isEmpty()) {
        builder.expressionAttributeValues(values);
      }
    }
    try {
      dynamoDbClient.putItem(builder.build());
    } catch (ConditionalCheckFailedException e) {
      log.warn("Conditional put failed on {}: {}", tableName, conditionExpression);
      throw new ConditionFailedException("Condition failed for put on " + tableName, e);
    }
  }

  /**
   * Delete an item. Deleting a missing key does nothing.
   *
   * @param key the key
   */
  public void delete(final Map<String, AttributeValue> key) {
    delete(key, null, Map.of(), Map.of());
  }

  /**
   * Delete an item if the condition holds.
   *
   * @param key                 the key
   * @param conditionExpression the condition, null for none
   * @param names               the expression attribute names
   * @param values              the expression attribute values
   */
  public void delete(final Map<String, AttributeValue> key,
                     final String conditionExpression,
                     final Map<String, String> names,
                     final Map<String, AttributeValue> values) {
    log.trace("delete({}, {})", key, conditionExpression);
    final DeleteItemRequest.Builder builder = DeleteItemRequest.builder()
        .tableName(tableName)
        .key(key);
    if (conditionExpression != null) {
      builder.conditionExpression(conditionExpression);
      if (!names.isEmpty()) {
        builder.expressionAttributeNames(names);
      }
      if (!values.isEmpty()) {
        builder.expressionAttributeValues(values);
      }
    }
    try {
      dynamoDbClient.deleteItem(builder.build());
    } catch (ConditionalCheckFailedException e) {
      log.warn("Conditional delete failed on {}: {}", tableName, conditionExpression);
      throw new ConditionFailedException("Condition failed for delete on " + tableName, e);
    }
  }

  /**
   * Update attributes of an item with a SET expression.
   *
   * @param key     the key
   * @param options the assignments, condition and return mode
   * @return the updated entity when asked for, otherwise empty
   */
  public Optional<T> update(final Map<String, AttributeValue> key, final UpdateOptions options) {
    log.trace("update({}, {})", key, options);
    final Expression expression = updateExpressionBuilder.build(options.assignments(),
        options.expressionAttributeNames(), options.expressionAttributeValues());
    final UpdateItemRequest.Builder builder = UpdateItemRequest.builder()
        .tableName(tableName)
        .key(key)
        .updateExpression(expression.expression())
        .expressionAttributeNames(expression.names())
        .expressionAttributeValues(expression.values())
        .returnValues(options.returnUpdated() ? ReturnValue.ALL_NEW : ReturnValue.NONE);
    options.conditionExpression().ifPresent(builder::conditionExpression);
    final UpdateItemResponse response;
    try {
      response = dynamoDbClient.updateItem(builder.build());
    } catch (ConditionalCheckFailedException e) {
      log.warn("Conditional update failed on {}: {}", tableName, options.conditionExpression().orElse(""));
      throw new ConditionFailedException("Condition failed for update on " + tableName, e);
    }
    if (options.returnUpdated() && response.hasAttributes()) {
      return Optional.of(entityCodec.unmarshal(response.attributes()));
    }
    return Optional.empty();
  }
}
