package com.codeheadsystems.catalog.dagger;

import com.codeheadsystems.catalog.manager.CatalogTables;
import com.codeheadsystems.catalog.repository.BrandRepository;
import com.codeheadsystems.catalog.repository.CategoryRepository;
import com.codeheadsystems.catalog.repository.ProductRepository;
import com.codeheadsystems.entitystore.converter.CursorCodec;
import com.codeheadsystems.entitystore.dagger.CommonModule;
import com.codeheadsystems.entitystore.dagger.ConfigurationModule;
import com.codeheadsystems.entitystore.dagger.EntityStoreModule;
import com.codeheadsystems.entitystore.model.EntityStoreConfiguration;
import dagger.Component;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * The interface Catalog component.
 */
@Singleton
@Component(modules = {CatalogModule.class, EntityStoreModule.class, ConfigurationModule.class, CommonModule.class})
public interface CatalogComponent {

  /**
   * Instance catalog component.
   *
   * @param configuration  the configuration
   * @param dynamoDbClient the dynamo db client
   * @return the catalog component
   */
  static CatalogComponent instance(final EntityStoreConfiguration configuration,
                                   final DynamoDbClient dynamoDbClient) {
    return DaggerCatalogComponent.builder()
        .configurationModule(new ConfigurationModule(configuration, dynamoDbClient))
        .build();
  }

  /**
   * Catalog tables.
   *
   * @return the catalog tables
   */
  CatalogTables catalogTables();

  /**
   * Product repository.
   *
   * @return the product repository
   */
  ProductRepository productRepository();

  /**
   * Brand repository.
   *
   * @return the brand repository
   */
  BrandRepository brandRepository();

  /**
   * Category repository.
   *
   * @return the category repository
   */
  CategoryRepository categoryRepository();

  /**
   * Cursor codec.
   *
   * @return the cursor codec
   */
  CursorCodec cursorCodec();
}
