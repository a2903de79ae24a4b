package com.codeheadsystems.catalog.model;

import com.codeheadsystems.entitystore.model.Entity;
import com.codeheadsystems.entitystore.model.Timestamped;
import com.codeheadsystems.entitystore.model.Versioned;

/**
 * Identity, timestamps and version shared by every catalog entity.
 */
public abstract class CatalogEntity implements Entity, Timestamped, Versioned {

  private String id;
  private Long createdAt;
  private Long updatedAt;
  private Long version;

  @Override
  public String getId() {
    return id;
  }

  public void setId(final String id) {
    this.id = id;
  }

  @Override
  public Long getCreatedAt() {
    return createdAt;
  }

  @Override
  public void setCreatedAt(final Long createdAt) {
    this.createdAt = createdAt;
  }

  @Override
  public Long getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public void setUpdatedAt(final Long updatedAt) {
    this.updatedAt = updatedAt;
  }

  @Override
  public Long getVersion() {
    return version;
  }

  @Override
  public void setVersion(final Long version) {
    this.version = version;
  }
}
