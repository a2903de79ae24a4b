package com.codeheadsystems.entitystore.exception;

import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * A conditional put, delete or update did not hold. Covers duplicate keys on create and stale
 * versions on optimistic updates. Never retried by the store.
 */
public class ConditionFailedException extends EntityStoreException {

  /**
   * Instantiates a new Condition failed exception.
   *
   * @param message the message
   * @param cause   the store's conditional check failure
   */
  public ConditionFailedException(final String message, final ConditionalCheckFailedException cause) {
    super(message, cause);
  }
}
