package com.codeheadsystems.entitystore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Limits and timings of the entity store.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEntityStoreConfiguration.class)
@JsonDeserialize(builder = ImmutableEntityStoreConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface EntityStoreConfiguration {

  /**
   * Items per batch write call. The store rejects more than 25.
   *
   * @return the max batch size
   */
  @Value.Default
  default int maxBatchSize() {
    return 25;
  }

  /**
   * Attempts per batch chunk, the first one included.
   *
   * @return the max batch attempts
   */
  @Value.Default
  default int maxBatchAttempts() {
    return 3;
  }

  /**
   * Base of the quadratic backoff between batch attempts.
   *
   * @return the base in millis
   */
  @Value.Default
  default long batchBackoffBaseMillis() {
    return 100L;
  }

  /**
   * How long to wait for a new table to become active.
   *
   * @return the timeout in seconds
   */
  @Value.Default
  default long tableActiveTimeoutSeconds() {
    return 300L;
  }

  /**
   * Delay between table status checks.
   *
   * @return the poll interval in millis
   */
  @Value.Default
  default long tablePollIntervalMillis() {
    return 2000L;
  }

  /**
   * Rejects limits the store cannot honour.
   */
  @Value.Check
  default void check() {
    if (maxBatchSize() < 1 || maxBatchSize() > 25) {
      throw new IllegalStateException("maxBatchSize must be between 1 and 25: " + maxBatchSize());
    }
    if (maxBatchAttempts() < 1) {
      throw new IllegalStateException("maxBatchAttempts must be positive: " + maxBatchAttempts());
    }
  }

}
