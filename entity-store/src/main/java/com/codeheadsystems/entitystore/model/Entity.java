package com.codeheadsystems.entitystore.model;

/**
 * Anything the entity store can persist. The id is the value of the table's partition key.
 */
public interface Entity {

  /**
   * Id string.
   *
   * @return the id
   */
  String getId();

}
