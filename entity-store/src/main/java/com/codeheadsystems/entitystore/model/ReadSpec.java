package com.codeheadsystems.entitystore.model;

import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Options shared by queries and scans. Every option is independent and left off the request
 * when absent.
 */
public interface ReadSpec {

  /**
   * Secondary index to read instead of the table.
   *
   * @return the index name
   */
  Optional<String> indexName();

  /**
   * Filter expression, applied by the store after reading.
   *
   * @return the filter expression
   */
  Optional<String> filterExpression();

  /**
   * Projection expression limiting the returned attributes.
   *
   * @return the projection expression
   */
  Optional<String> projectionExpression();

  /**
   * Expression attribute names.
   *
   * @return the names
   */
  Map<String, String> expressionAttributeNames();

  /**
   * Expression attribute values.
   *
   * @return the values
   */
  Map<String, AttributeValue> expressionAttributeValues();

  /**
   * Most items returned. Also the per-request limit when no page size is given.
   *
   * @return the limit
   */
  Optional<Integer> limit();

  /**
   * Strongly consistent read. Eventual when absent.
   *
   * @return the consistent read flag
   */
  Optional<Boolean> consistentRead();

  /**
   * Cursor to resume from, empty to start at the beginning.
   *
   * @return the exclusive start key
   */
  Map<String, AttributeValue> exclusiveStartKey();

  /**
   * Items per store request. Falls back to the limit when absent.
   *
   * @return the page size
   */
  Optional<Integer> pageSize();

  /**
   * The limit sent with each store request.
   *
   * @return the page size, else the limit
   */
  default Optional<Integer> requestLimit() {
    return pageSize().or(this::limit);
  }

}
