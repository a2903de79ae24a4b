package com.codeheadsystems.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * A brand products are sold under.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Brand extends CatalogEntity {

  private String name;

  /**
   * Instantiates a new Brand.
   */
  public Brand() {
  }

  /**
   * Instantiates a new Brand.
   *
   * @param id   the id
   * @param name the name
   */
  public Brand(final String id, final String name) {
    setId(id);
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Brand other = (Brand) o;
    return Objects.equals(getId(), other.getId())
        && Objects.equals(name, other.name)
        && Objects.equals(getCreatedAt(), other.getCreatedAt())
        && Objects.equals(getUpdatedAt(), other.getUpdatedAt())
        && Objects.equals(getVersion(), other.getVersion());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getId(), name, getCreatedAt(), getUpdatedAt(), getVersion());
  }

  @Override
  public String toString() {
    return "Brand{id=" + getId() + ", name=" + name + ", version=" + getVersion() + "}";
  }
}
