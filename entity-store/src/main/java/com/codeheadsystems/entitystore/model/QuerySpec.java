package com.codeheadsystems.entitystore.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * A query against the table or one of its indexes.
 */
@Value.Immutable
public interface QuerySpec extends ReadSpec {

  /**
   * Key condition expression. The store rejects queries without one.
   *
   * @return the key condition expression
   */
  Optional<String> keyConditionExpression();

  /**
   * Ascending by sort key unless false.
   *
   * @return the scan index forward flag
   */
  Optional<Boolean> scanIndexForward();

}
