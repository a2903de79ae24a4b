package com.codeheadsystems.catalog.dagger;

import com.codeheadsystems.catalog.model.Brand;
import com.codeheadsystems.catalog.model.Category;
import com.codeheadsystems.catalog.model.Product;
import com.codeheadsystems.catalog.repository.BrandRepository;
import com.codeheadsystems.catalog.repository.CategoryRepository;
import com.codeheadsystems.catalog.repository.ProductRepository;
import com.codeheadsystems.entitystore.repository.RepositoryFactory;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Wires the catalog repositories to their tables.
 */
@Module
public class CatalogModule {

  /**
   * Instantiates a new Catalog module.
   */
  public CatalogModule() {
    // Default constructor
  }

  /**
   * Product repository.
   *
   * @param factory the factory
   * @return the product repository
   */
  @Provides
  @Singleton
  public ProductRepository productRepository(final RepositoryFactory factory) {
    return new ProductRepository(factory.table(Product.class, ProductRepository.TABLE_NAME),
        factory.keyBuilder(), factory.capabilityInjector());
  }

  /**
   * Brand repository.
   *
   * @param factory the factory
   * @return the brand repository
   */
  @Provides
  @Singleton
  public BrandRepository brandRepository(final RepositoryFactory factory) {
    return new BrandRepository(factory.table(Brand.class, BrandRepository.TABLE_NAME),
        factory.keyBuilder(), factory.capabilityInjector());
  }

  /**
   * Category repository.
   *
   * @param factory the factory
   * @return the category repository
   */
  @Provides
  @Singleton
  public CategoryRepository categoryRepository(final RepositoryFactory factory) {
    return new CategoryRepository(factory.table(Category.class, CategoryRepository.TABLE_NAME),
        factory.keyBuilder(), factory.capabilityInjector());
  }
}
