package com.codeheadsystems.entitystore.model;

/**
 * Optional capability: the store stamps creation and update instants, in epoch seconds.
 */
public interface Timestamped {

  /**
   * Created at, epoch seconds.
   *
   * @return the created at
   */
  Long getCreatedAt();

  /**
   * Sets created at.
   *
   * @param createdAt epoch seconds
   */
  void setCreatedAt(Long createdAt);

  /**
   * Updated at, epoch seconds.
   *
   * @return the updated at
   */
  Long getUpdatedAt();

  /**
   * Sets updated at.
   *
   * @param updatedAt epoch seconds
   */
  void setUpdatedAt(Long updatedAt);

}
