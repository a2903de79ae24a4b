package com.codeheadsystems.entitystore.exception;

/**
 * A stored item could not be turned back into an entity.
 */
public class DecodingException extends EntityStoreException {

  /**
   * Instantiates a new Decoding exception.
   *
   * @param message the message
   */
  public DecodingException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Decoding exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecodingException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
