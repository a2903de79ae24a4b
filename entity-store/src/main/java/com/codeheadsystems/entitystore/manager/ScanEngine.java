package com.codeheadsystems.entitystore.manager;

import com.codeheadsystems.entitystore.converter.EntityCodec;
import com.codeheadsystems.entitystore.exception.QueryException;
import com.codeheadsystems.entitystore.model.ImmutablePageResult;
import com.codeheadsystems.entitystore.model.PageResult;
import com.codeheadsystems.entitystore.model.ScanSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

/**
 * Full table scans. The exhaustive variant follows the cursor until the store has no more
 * pages; the paged variant returns one page and its cursor. Either way the cost is the size of
 * the table, filters only reduce what comes back.
 *
 * @param <T> the entity type
 */
public class ScanEngine<T> {

  private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

  private final DynamoDbClient dynamoDbClient;
  private final EntityCodec<T> entityCodec;
  private final String tableName;

  /**
   * Instantiates a new Scan engine.
   *
   * @param dynamoDbClient the dynamo db client
   * @param entityCodec    the entity codec
   * @param tableName      the table name
   */
  public ScanEngine(final DynamoDbClient dynamoDbClient,
                    final EntityCodec<T> entityCodec,
                    final String tableName) {
    log.info("ScanEngine({}, {})", entityCodec.entityClass().getSimpleName(), tableName);
    this.dynamoDbClient = dynamoDbClient;
    this.entityCodec = entityCodec;
    this.tableName = tableName;
  }

  /**
   * Scan every page.
   *
   * @param spec the scan spec
   * @return all matching entities, empty when nothing matches
   */
  public List<T> scanAll(final ScanSpec spec) {
    log.trace("scanAll({})", spec);
    final List<T> results = new ArrayList<>();
    Map<String, AttributeValue> cursor = spec.exclusiveStartKey();
    int pages = 0;
    do {
      final ScanResponse response = execute(request(spec, cursor));
      pages++;
      for (Map<String, AttributeValue> item : response.items()) {
        if (spec.limit().isPresent() && results.size() >= spec.limit().get()) {
          return results;
        }
        results.add(decode(spec, item));
      }
      cursor = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : Map.of();
    } while (!cursor.isEmpty() && (spec.limit().isEmpty() || results.size() < spec.limit().get()));
    log.debug("Scanned {} pages of {} for {} items", pages, tableName, results.size());
    return results;
  }

  /**
   * Scan a single page.
   *
   * @param spec the scan spec, its exclusive start key is the cursor
   * @return the page
   */
  public PageResult<T> scanPage(final ScanSpec spec) {
    log.trace("scanPage({})", spec);
    final ScanResponse response = execute(request(spec, spec.exclusiveStartKey()));
    final List<T> items = new ArrayList<>();
    response.items().forEach(item -> items.add(decode(spec, item)));
    return ImmutablePageResult.<T>builder()
        .items(items)
        .lastEvaluatedKey(response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : Map.of())
        .build();
  }

  private ScanRequest request(final ScanSpec spec, final Map<String, AttributeValue> cursor) {
    final ScanRequest.Builder builder = ScanRequest.builder().tableName(tableName);
    spec.indexName().ifPresent(builder::indexName);
    spec.filterExpression().ifPresent(builder::filterExpression);
    spec.projectionExpression().ifPresent(builder::projectionExpression);
    spec.consistentRead().ifPresent(builder::consistentRead);
    spec.requestLimit().ifPresent(builder::limit);
    if (!spec.expressionAttributeNames().isEmpty()) {
      builder.expressionAttributeNames(spec.expressionAttributeNames());
    }
    if (!spec.expressionAttributeValues().isEmpty()) {
      builder.expressionAttributeValues(spec.expressionAttributeValues());
    }
    if (!cursor.isEmpty()) {
      builder.exclusiveStartKey(cursor);
    }
    return builder.build();
  }

  private ScanResponse execute(final ScanRequest request) {
    try {
      return dynamoDbClient.scan(request);
    } catch (DynamoDbException e) {
      log.warn("Scan on {} rejected: {}", tableName, e.getMessage());
      throw new QueryException("Scan on " + tableName + " failed: " + e.getMessage(), e);
    }
  }

  private T decode(final ScanSpec spec, final Map<String, AttributeValue> item) {
    return spec.projectionExpression().isPresent()
        ? entityCodec.unmarshalProjection(item)
        : entityCodec.unmarshal(item);
  }
}
