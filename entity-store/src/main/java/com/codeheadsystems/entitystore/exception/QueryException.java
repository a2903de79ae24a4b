package com.codeheadsystems.entitystore.exception;

/**
 * The store rejected a query or scan request.
 */
public class QueryException extends EntityStoreException {

  /**
   * Instantiates a new Query exception.
   *
   * @param message the message
   */
  public QueryException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Query exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public QueryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
