package com.codeheadsystems.entitystore.exception;

import java.util.List;

/**
 * A batch write finished with items that were never accepted, either because they stayed
 * unprocessed after every attempt or because they could not be encoded.
 */
public class PartialBatchFailureException extends EntityStoreException {

  private final int writtenCount;
  private final int remainingCount;
  private final List<EncodingException> encodingFailures;

  /**
   * Instantiates a new Partial batch failure exception.
   *
   * @param writtenCount     items the store accepted
   * @param remainingCount   items left unprocessed when the attempts ran out
   * @param encodingFailures items skipped because they could not be encoded
   */
  public PartialBatchFailureException(final int writtenCount,
                                      final int remainingCount,
                                      final List<EncodingException> encodingFailures) {
    super(String.format("Batch write incomplete: written=%d, remaining=%d, encodingFailures=%d",
        writtenCount, remainingCount, encodingFailures.size()));
    this.writtenCount = writtenCount;
    this.remainingCount = remainingCount;
    this.encodingFailures = List.copyOf(encodingFailures);
  }

  /**
   * Written count.
   *
   * @return the count
   */
  public int writtenCount() {
    return writtenCount;
  }

  /**
   * Remaining count.
   *
   * @return the count
   */
  public int remainingCount() {
    return remainingCount;
  }

  /**
   * Encoding failures.
   *
   * @return the failures
   */
  public List<EncodingException> encodingFailures() {
    return encodingFailures;
  }
}
