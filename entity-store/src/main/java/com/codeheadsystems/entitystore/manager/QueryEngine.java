package com.codeheadsystems.entitystore.manager;

import com.codeheadsystems.entitystore.converter.EntityCodec;
import com.codeheadsystems.entitystore.exception.QueryException;
import com.codeheadsystems.entitystore.model.ImmutablePageResult;
import com.codeheadsystems.entitystore.model.PageResult;
import com.codeheadsystems.entitystore.model.QuerySpec;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;

/**
 * Runs queries against a table or its indexes. Only the options set on the query spec are sent.
 *
 * @param <T> the entity type
 */
public class QueryEngine<T> {

  private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("#[A-Za-z0-9_]+");

  private final DynamoDbClient dynamoDbClient;
  private final EntityCodec<T> entityCodec;
  private final String tableName;

  /**
   * Instantiates a new Query engine.
   *
   * @param dynamoDbClient the dynamo db client
   * @param entityCodec    the entity codec
   * @param tableName      the table name
   */
  public QueryEngine(final DynamoDbClient dynamoDbClient,
                     final EntityCodec<T> entityCodec,
                     final String tableName) {
    log.info("QueryEngine({}, {})", entityCodec.entityClass().getSimpleName(), tableName);
    this.dynamoDbClient = dynamoDbClient;
    this.entityCodec = entityCodec;
    this.tableName = tableName;
  }

  /**
   * Query every page, stopping early once the query's limit is reached.
   *
   * @param spec the query spec
   * @return the entities in store order
   */
  public List<T> query(final QuerySpec spec) {
    log.trace("query({})", spec);
    final List<T> results = new ArrayList<>();
    Map<String, AttributeValue> cursor = spec.exclusiveStartKey();
    do {
      final QueryResponse response = execute(request(spec, cursor).build());
      for (Map<String, AttributeValue> item : response.items()) {
        if (spec.limit().isPresent() && results.size() >= spec.limit().get()) {
          return results;
        }
        results.add(decode(spec, item));
      }
      cursor = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : Map.of();
    } while (!cursor.isEmpty() && (spec.limit().isEmpty() || results.size() < spec.limit().get()));
    return results;
  }

  /**
   * Query a single page.
   *
   * @param spec the query spec, its exclusive start key is the cursor
   * @return the page
   */
  public PageResult<T> queryPage(final QuerySpec spec) {
    log.trace("queryPage({})", spec);
    final QueryResponse response = execute(request(spec, spec.exclusiveStartKey()).build());
    final List<T> items = new ArrayList<>();
    response.items().forEach(item -> items.add(decode(spec, item)));
    return ImmutablePageResult.<T>builder()
        .items(items)
        .lastEvaluatedKey(response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : Map.of())
        .build();
  }

  /**
   * Count the matching items over every page.
   *
   * @param spec the query spec
   * @return the count
   */
  public long count(final QuerySpec spec) {
    log.trace("count({})", spec);
    long count = 0;
    Map<String, AttributeValue> cursor = spec.exclusiveStartKey();
    do {
      final QueryResponse response = execute(countRequest(spec, cursor));
      count += response.count() == null ? 0 : response.count();
      cursor = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : Map.of();
    } while (!cursor.isEmpty());
    return count;
  }

  private QueryRequest.Builder request(final QuerySpec spec, final Map<String, AttributeValue> cursor) {
    final QueryRequest.Builder builder = QueryRequest.builder().tableName(tableName);
    spec.indexName().ifPresent(builder::indexName);
    spec.keyConditionExpression().ifPresent(builder::keyConditionExpression);
    spec.filterExpression().ifPresent(builder::filterExpression);
    spec.projectionExpression().ifPresent(builder::projectionExpression);
    spec.scanIndexForward().ifPresent(builder::scanIndexForward);
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
    return builder;
  }

  /**
   * A count request carries no projection, so names only the projection used are dropped.
   */
  private QueryRequest countRequest(final QuerySpec spec, final Map<String, AttributeValue> cursor) {
    final QueryRequest.Builder builder = request(spec, cursor)
        .select(Select.COUNT)
        .projectionExpression(null);
    if (!spec.expressionAttributeNames().isEmpty()) {
      final Set<String> used = PLACEHOLDER
          .matcher(spec.keyConditionExpression().orElse("") + " " + spec.filterExpression().orElse(""))
          .results()
          .map(MatchResult::group)
          .collect(Collectors.toSet());
      final Map<String, String> names = new HashMap<>(spec.expressionAttributeNames());
      names.keySet().retainAll(used);
      builder.expressionAttributeNames(names.isEmpty() ? null : names);
    }
    return builder.build();
  }

  private QueryResponse execute(final QueryRequest request) {
    try {
      return dynamoDbClient.query(request);
    } catch (DynamoDbException e) {
      log.warn("Query on {} rejected: {}", tableName, e.getMessage());
      throw new QueryException("Query on " + tableName + " failed: " + e.getMessage(), e);
    }
  }

  private T decode(final QuerySpec spec, final Map<String, AttributeValue> item) {
    return spec.projectionExpression().isPresent()
        ? entityCodec.unmarshalProjection(item)
        : entityCodec.unmarshal(item);
  }
}
