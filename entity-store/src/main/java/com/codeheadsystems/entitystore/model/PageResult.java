package com.codeheadsystems.entitystore.model;

import java.util.List;
import java.util.Map;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * One page of a query or scan.
 *
 * @param <T> the entity type
 */
@Value.Immutable
public interface PageResult<T> {

  /**
   * Items of this page.
   *
   * @return the items
   */
  List<T> items();

  /**
   * The cursor to pass as exclusive start key for the next page. Empty when exhausted.
   *
   * @return the last evaluated key
   */
  Map<String, AttributeValue> lastEvaluatedKey();

  /**
   * Whether another page exists.
   *
   * @return true if more items may follow
   */
  @Value.Derived
  default boolean hasMore() {
    return !lastEvaluatedKey().isEmpty();
  }

}
