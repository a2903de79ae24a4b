package com.codeheadsystems.entitystore.exception;

/**
 * An entity or value has no attribute value representation.
 */
public class EncodingException extends EntityStoreException {

  /**
   * Instantiates a new Encoding exception.
   *
   * @param message the message
   */
  public EncodingException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Encoding exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EncodingException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
