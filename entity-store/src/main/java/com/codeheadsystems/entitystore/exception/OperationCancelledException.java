package com.codeheadsystems.entitystore.exception;

/**
 * The calling thread was interrupted while waiting on a batch backoff or for a table to become
 * active. The interrupt flag is restored before this is thrown.
 */
public class OperationCancelledException extends EntityStoreException {

  /**
   * Instantiates a new Operation cancelled exception.
   *
   * @param message the message
   * @param cause   the interruption
   */
  public OperationCancelledException(final String message, final InterruptedException cause) {
    super(message, cause);
  }
}
