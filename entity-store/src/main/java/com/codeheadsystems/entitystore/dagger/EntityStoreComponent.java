package com.codeheadsystems.entitystore.dagger;

import com.codeheadsystems.entitystore.converter.CursorCodec;
import com.codeheadsystems.entitystore.manager.TableManager;
import com.codeheadsystems.entitystore.model.EntityStoreConfiguration;
import com.codeheadsystems.entitystore.repository.RepositoryFactory;
import dagger.Component;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * The interface Entity store component.
 */
@Singleton
@Component(modules = {EntityStoreModule.class, ConfigurationModule.class, CommonModule.class})
public interface EntityStoreComponent {

  /**
   * Instance entity store component.
   *
   * @param configuration  the configuration
   * @param dynamoDbClient the dynamo db client
   * @return the entity store component
   */
  static EntityStoreComponent instance(final EntityStoreConfiguration configuration,
                                       final DynamoDbClient dynamoDbClient) {
    return DaggerEntityStoreComponent.builder()
        .configurationModule(new ConfigurationModule(configuration, dynamoDbClient))
        .build();
  }

  /**
   * Repository factory.
   *
   * @return the repository factory
   */
  RepositoryFactory repositoryFactory();

  /**
   * Table manager.
   *
   * @return the table manager
   */
  TableManager tableManager();

  /**
   * Cursor codec.
   *
   * @return the cursor codec
   */
  CursorCodec cursorCodec();
}
