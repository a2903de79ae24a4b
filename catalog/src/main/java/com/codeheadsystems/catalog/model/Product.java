package com.codeheadsystems.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

/**
 * A product of the catalog. Brand and category are referenced by id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Product extends CatalogEntity {

  private String name;
  private double price;
  private String description;
  private String status;
  private String brandId;
  private String categoryId;
  private List<ImageUrl> imageUrls;

  /**
   * Instantiates a new Product.
   */
  public Product() {
  }

  /**
   * Instantiates a new Product.
   *
   * @param id    the id
   * @param name  the name
   * @param price the price
   */
  public Product(final String id, final String name, final double price) {
    setId(id);
    this.name = name;
    this.price = price;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  public double getPrice() {
    return price;
  }

  public void setPrice(final double price) {
    this.price = price;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(final String description) {
    this.description = description;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(final String status) {
    this.status = status;
  }

  public String getBrandId() {
    return brandId;
  }

  public void setBrandId(final String brandId) {
    this.brandId = brandId;
  }

  public String getCategoryId() {
    return categoryId;
  }

  public void setCategoryId(final String categoryId) {
    this.categoryId = categoryId;
  }

  public List<ImageUrl> getImageUrls() {
    return imageUrls;
  }

  public void setImageUrls(final List<ImageUrl> imageUrls) {
    this.imageUrls = imageUrls;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Product product = (Product) o;
    return Double.compare(product.price, price) == 0
        && Objects.equals(getId(), product.getId())
        && Objects.equals(name, product.name)
        && Objects.equals(description, product.description)
        && Objects.equals(status, product.status)
        && Objects.equals(brandId, product.brandId)
        && Objects.equals(categoryId, product.categoryId)
        && Objects.equals(imageUrls, product.imageUrls)
        && Objects.equals(getCreatedAt(), product.getCreatedAt())
        && Objects.equals(getUpdatedAt(), product.getUpdatedAt())
        && Objects.equals(getVersion(), product.getVersion());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getId(), name, price, description, status, brandId, categoryId, imageUrls,
        getCreatedAt(), getUpdatedAt(), getVersion());
  }

  @Override
  public String toString() {
    return "Product{id=" + getId() + ", name=" + name + ", status=" + status
        + ", brandId=" + brandId + ", categoryId=" + categoryId + ", version=" + getVersion() + "}";
  }
}
