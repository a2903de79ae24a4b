package com.codeheadsystems.entitystore.dagger;

import com.codeheadsystems.entitystore.model.EntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.ImmutableEntityStoreConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Supplies what the entity store is handed from outside: its limits and an authenticated
 * client.
 */
@Module
public class ConfigurationModule {

  private final EntityStoreConfiguration configuration;
  private final DynamoDbClient dynamoDbClient;

  /**
   * Instantiates a new Configuration module with default limits.
   *
   * @param dynamoDbClient the dynamo db client
   */
  public ConfigurationModule(final DynamoDbClient dynamoDbClient) {
    this(ImmutableEntityStoreConfiguration.builder().build(), dynamoDbClient);
  }

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration  the configuration
   * @param dynamoDbClient the dynamo db client
   */
  public ConfigurationModule(final EntityStoreConfiguration configuration,
                             final DynamoDbClient dynamoDbClient) {
    this.configuration = configuration;
    this.dynamoDbClient = dynamoDbClient;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public EntityStoreConfiguration configuration() {
    return configuration;
  }

  /**
   * Dynamo db client.
   *
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient() {
    return dynamoDbClient;
  }
}
