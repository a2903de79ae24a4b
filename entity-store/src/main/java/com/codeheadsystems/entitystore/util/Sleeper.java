package com.codeheadsystems.entitystore.util;

/**
 * Pauses the calling thread. Tests replace it to record delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleep.
   *
   * @param millis the millis
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(long millis) throws InterruptedException;

}
