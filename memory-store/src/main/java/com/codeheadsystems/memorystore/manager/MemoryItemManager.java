package com.codeheadsystems.memorystore.manager;

import com.codeheadsystems.memorystore.BatchWritePolicy;
import com.codeheadsystems.memorystore.expression.ConditionExpressionEvaluator;
import com.codeheadsystems.memorystore.expression.UpdateExpressionEvaluator;
import com.codeheadsystems.memorystore.model.MemoryTable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Item operations over the in-memory tables. Writes are serialized so conditional writes are
 * atomic with respect to each other.
 */
public class MemoryItemManager {

  private static final Logger log = LoggerFactory.getLogger(MemoryItemManager.class);
  private static final int MAX_BATCH_WRITE = 25;

  private final MemoryTableManager tableManager;
  private final ConditionExpressionEvaluator conditionExpressionEvaluator;
  private final UpdateExpressionEvaluator updateExpressionEvaluator;
  private final Object writeLock = new Object();
  private volatile BatchWritePolicy batchWritePolicy;

  /**
   * Instantiates a new Memory item manager.
   *
   * @param tableManager                 the table manager
   * @param conditionExpressionEvaluator the condition expression evaluator
   * @param updateExpressionEvaluator    the update expression evaluator
   */
  public MemoryItemManager(final MemoryTableManager tableManager,
                           final ConditionExpressionEvaluator conditionExpressionEvaluator,
                           final UpdateExpressionEvaluator updateExpressionEvaluator) {
    log.info("MemoryItemManager({}, {}, {})", tableManager, conditionExpressionEvaluator, updateExpressionEvaluator);
    this.tableManager = tableManager;
    this.conditionExpressionEvaluator = conditionExpressionEvaluator;
    this.updateExpressionEvaluator = updateExpressionEvaluator;
    this.batchWritePolicy = BatchWritePolicy.PROCESS_ALL;
  }

  /**
   * Replace the batch write policy.
   *
   * @param batchWritePolicy the policy
   */
  public void setBatchWritePolicy(final BatchWritePolicy batchWritePolicy) {
    this.batchWritePolicy = batchWritePolicy;
  }

  /**
   * Put item.
   *
   * @param request the request
   * @return the response
   */
  public PutItemResponse putItem(final PutItemRequest request) {
    log.trace("putItem({})", request);
    final MemoryTable table = tableManager.requireTable(request.tableName());
    final String storageKey = table.storageKey(request.item());
    synchronized (writeLock) {
      checkCondition(table.items().get(storageKey), request.conditionExpression(),
          request.expressionAttributeValues(), request.expressionAttributeNames());
      table.items().put(storageKey, Map.copyOf(request.item()));
    }
    return PutItemResponse.builder().build();
  }

  /**
   * Get item.
   *
   * @param request the request
   * @return the response, with no item when the key is absent
   */
  public GetItemResponse getItem(final GetItemRequest request) {
    log.trace("getItem({})", request);
    final MemoryTable table = tableManager.requireTable(request.tableName());
    final Map<String, AttributeValue> item = table.items().get(table.storageKey(request.key()));
    if (item == null) {
      return GetItemResponse.builder().build();
    }
    return GetItemResponse.builder()
        .item(project(item, request.projectionExpression(), request.expressionAttributeNames()))
        .build();
  }

  /**
   * Update item. Creates the item from its key when absent.
   *
   * @param request the request
   * @return the response, holding the new image when ALL_NEW was asked for
   */
  public UpdateItemResponse updateItem(final UpdateItemRequest request) {
    log.trace("updateItem({})", request);
    final MemoryTable table = tableManager.requireTable(request.tableName());
    final String storageKey = table.storageKey(request.key());
    final Map<String, AttributeValue> updated;
    synchronized (writeLock) {
      final Map<String, AttributeValue> existing = table.items().get(storageKey);
      checkCondition(existing, request.conditionExpression(),
          request.expressionAttributeValues(), request.expressionAttributeNames());
      updated = updateExpressionEvaluator.apply(
          existing == null ? request.key() : existing,
          request.updateExpression(),
          request.expressionAttributeValues(),
          request.expressionAttributeNames());
      table.items().put(storageKey, Map.copyOf(updated));
    }
    final UpdateItemResponse.Builder builder = UpdateItemResponse.builder();
    if (request.returnValues() == ReturnValue.ALL_NEW) {
      builder.attributes(updated);
    }
    return builder.build();
  }

  /**
   * Delete item.
   *
   * @param request the request
   * @return the response
   */
  public DeleteItemResponse deleteItem(final DeleteItemRequest request) {
    log.trace("deleteItem({})", request);
    final MemoryTable table = tableManager.requireTable(request.tableName());
    final String storageKey = table.storageKey(request.key());
    synchronized (writeLock) {
      checkCondition(table.items().get(storageKey), request.conditionExpression(),
          request.expressionAttributeValues(), request.expressionAttributeNames());
      table.items().remove(storageKey);
    }
    return DeleteItemResponse.builder().build();
  }

  /**
   * Batch write. Requests picked by the batch write policy are returned as unprocessed.
   *
   * @param request the request
   * @return the response
   */
  public BatchWriteItemResponse batchWriteItem(final BatchWriteItemRequest request) {
    log.trace("batchWriteItem({})", request);
    final int total = request.requestItems().values().stream().mapToInt(List::size).sum();
    if (total > MAX_BATCH_WRITE) {
      throw validation("Too many items requested for the BatchWriteItem call");
    }
    final Map<String, List<WriteRequest>> unprocessed = new HashMap<>();
    for (Map.Entry<String, List<WriteRequest>> entry : request.requestItems().entrySet()) {
      final String tableName = entry.getKey();
      final MemoryTable table = tableManager.requireTable(tableName);
      final List<WriteRequest> skipped = batchWritePolicy.unprocessed(tableName, entry.getValue());
      for (WriteRequest writeRequest : entry.getValue()) {
        if (skipped.contains(writeRequest)) {
          continue;
        }
        if (writeRequest.putRequest() != null) {
          final Map<String, AttributeValue> item = writeRequest.putRequest().item();
          synchronized (writeLock) {
            table.items().put(table.storageKey(item), Map.copyOf(item));
          }
        } else if (writeRequest.deleteRequest() != null) {
          synchronized (writeLock) {
            table.items().remove(table.storageKey(writeRequest.deleteRequest().key()));
          }
        }
      }
      if (!skipped.isEmpty()) {
        log.debug("Leaving {} requests unprocessed for {}", skipped.size(), tableName);
        unprocessed.put(tableName, List.copyOf(skipped));
      }
    }
    return BatchWriteItemResponse.builder().unprocessedItems(unprocessed).build();
  }

  /**
   * Query a table or one of its indexes.
   *
   * @param request the request
   * @return the response
   */
  public QueryResponse query(final QueryRequest request) {
    log.trace("query({})", request);
    final MemoryTable table = tableManager.requireTable(request.tableName());
    if (request.keyConditionExpression() == null || request.keyConditionExpression().isBlank()) {
      throw validation("Either the KeyConditions or KeyConditionExpression parameter must be specified in the request.");
    }
    final MemoryTable.KeyDefinition keyDefinition;
    if (request.indexName() != null && !request.indexName().isBlank()) {
      keyDefinition = table.index(request.indexName())
          .orElseThrow(() -> validation("The table does not have the specified index: " + request.indexName()));
    } else {
      keyDefinition = table.primaryKey();
    }
    final List<Map<String, AttributeValue>> candidates = table.items().values().stream()
        .filter(item -> item.containsKey(keyDefinition.hashKey()))
        .filter(item -> keyDefinition.sortKey().map(item::containsKey).orElse(true))
        .filter(item -> conditionExpressionEvaluator.evaluate(item, request.keyConditionExpression(),
            request.expressionAttributeValues(), request.expressionAttributeNames()))
        .collect(Collectors.toList());
    keyDefinition.sortKey().ifPresent(sortKey -> {
      Comparator<Map<String, AttributeValue>> comparator = (a, b) ->
          conditionExpressionEvaluator.compare(a.get(sortKey), b.get(sortKey)).orElse(0);
      if (Boolean.FALSE.equals(request.scanIndexForward())) {
        comparator = comparator.reversed();
      }
      candidates.sort(comparator);
    });
    final Page page = page(table, keyDefinition, candidates, request.exclusiveStartKey(), request.limit(),
        request.filterExpression(), request.expressionAttributeValues(), request.expressionAttributeNames());
    final QueryResponse.Builder builder = QueryResponse.builder()
        .count(page.items.size())
        .scannedCount(page.scanned);
    if (request.select() != Select.COUNT) {
      builder.items(page.items.stream()
          .map(item -> project(item, request.projectionExpression(), request.expressionAttributeNames()))
          .collect(Collectors.toList()));
    }
    page.lastEvaluatedKey.ifPresent(builder::lastEvaluatedKey);
    return builder.build();
  }

  /**
   * Scan a table in primary key order.
   *
   * @param request the request
   * @return the response
   */
  public ScanResponse scan(final ScanRequest request) {
    log.trace("scan({})", request);
    final MemoryTable table = tableManager.requireTable(request.tableName());
    final List<Map<String, AttributeValue>> candidates = new ArrayList<>(table.items().values());
    final Page page = page(table, table.primaryKey(), candidates, request.exclusiveStartKey(), request.limit(),
        request.filterExpression(), request.expressionAttributeValues(), request.expressionAttributeNames());
    final ScanResponse.Builder builder = ScanResponse.builder()
        .count(page.items.size())
        .scannedCount(page.scanned);
    if (request.select() != Select.COUNT) {
      builder.items(page.items.stream()
          .map(item -> project(item, request.projectionExpression(), request.expressionAttributeNames()))
          .collect(Collectors.toList()));
    }
    page.lastEvaluatedKey.ifPresent(builder::lastEvaluatedKey);
    return builder.build();
  }

  private Page page(final MemoryTable table,
                    final MemoryTable.KeyDefinition keyDefinition,
                    final List<Map<String, AttributeValue>> candidates,
                    final Map<String, AttributeValue> exclusiveStartKey,
                    final Integer limit,
                    final String filterExpression,
                    final Map<String, AttributeValue> values,
                    final Map<String, String> names) {
    int start = 0;
    if (exclusiveStartKey != null && !exclusiveStartKey.isEmpty()) {
      final String startKey = table.storageKey(exclusiveStartKey);
      for (int i = 0; i < candidates.size(); i++) {
        if (table.storageKey(candidates.get(i)).equals(startKey)) {
          start = i + 1;
          break;
        }
      }
    }
    final int end = limit == null ? candidates.size() : Math.min(candidates.size(), start + limit);
    final List<Map<String, AttributeValue>> evaluated = candidates.subList(start, end);
    final List<Map<String, AttributeValue>> matched = evaluated.stream()
        .filter(item -> conditionExpressionEvaluator.evaluate(item, filterExpression, values, names))
        .collect(Collectors.toList());
    Optional<Map<String, AttributeValue>> lastEvaluatedKey = Optional.empty();
    if (end < candidates.size() && !evaluated.isEmpty()) {
      final Map<String, AttributeValue> last = evaluated.get(evaluated.size() - 1);
      final Map<String, AttributeValue> key = new LinkedHashMap<>(table.keyOf(last));
      key.put(keyDefinition.hashKey(), last.get(keyDefinition.hashKey()));
      keyDefinition.sortKey().ifPresent(sortKey -> key.put(sortKey, last.get(sortKey)));
      lastEvaluatedKey = Optional.of(key);
    }
    return new Page(matched, evaluated.size(), lastEvaluatedKey);
  }

  private Map<String, AttributeValue> project(final Map<String, AttributeValue> item,
                                              final String projectionExpression,
                                              final Map<String, String> names) {
    if (projectionExpression == null || projectionExpression.isBlank()) {
      return item;
    }
    final Set<String> wanted = new HashSet<>();
    for (String token : projectionExpression.split(",")) {
      wanted.add(conditionExpressionEvaluator.resolveName(token.trim(), names));
    }
    final Map<String, AttributeValue> projected = new HashMap<>();
    item.forEach((name, value) -> {
      if (wanted.contains(name)) {
        projected.put(name, value);
      }
    });
    return projected;
  }

  private void checkCondition(final Map<String, AttributeValue> existing,
                              final String conditionExpression,
                              final Map<String, AttributeValue> values,
                              final Map<String, String> names) {
    if (!conditionExpressionEvaluator.evaluate(existing, conditionExpression, values, names)) {
      throw ConditionalCheckFailedException.builder()
          .message("The conditional request failed")
          .statusCode(400)
          .build();
    }
  }

  private DynamoDbException validation(final String message) {
    return (DynamoDbException) DynamoDbException.builder()
        .message(message)
        .statusCode(400)
        .build();
  }

  private static class Page {

    private final List<Map<String, AttributeValue>> items;
    private final int scanned;
    private final Optional<Map<String, AttributeValue>> lastEvaluatedKey;

    private Page(final List<Map<String, AttributeValue>> items,
                 final int scanned,
                 final Optional<Map<String, AttributeValue>> lastEvaluatedKey) {
      this.items = items;
      this.scanned = scanned;
      this.lastEvaluatedKey = lastEvaluatedKey;
    }
  }
}
