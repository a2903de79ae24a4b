package com.codeheadsystems.entitystore.exception;

/**
 * The table could not be described or created, or did not become active in time.
 */
public class TableUnavailableException extends EntityStoreException {

  /**
   * Instantiates a new TableUnavailable exception.
   *
   * @param message the message
   */
  public TableUnavailableException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new TableUnavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TableUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
