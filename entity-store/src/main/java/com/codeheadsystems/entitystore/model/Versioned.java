package com.codeheadsystems.entitystore.model;

/**
 * Optional capability: a version number used for optimistic locking. Starts at 1 on save and
 * grows by exactly 1 on each update.
 */
public interface Versioned {

  /**
   * Version.
   *
   * @return the version, null before the first save
   */
  Long getVersion();

  /**
   * Sets version.
   *
   * @param version the version
   */
  void setVersion(Long version);

}
