package com.codeheadsystems.entitystore.exception;

/**
 * Root of every failure the entity store reports.
 */
public class EntityStoreException extends RuntimeException {

  /**
   * Instantiates a new Entity store exception.
   *
   * @param message the message
   */
  public EntityStoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Entity store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EntityStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
