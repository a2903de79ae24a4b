package com.codeheadsystems.entitystore.repository;

import com.codeheadsystems.entitystore.converter.AttributeValueConverter;
import com.codeheadsystems.entitystore.converter.EntityCodec;
import com.codeheadsystems.entitystore.converter.KeyBuilder;
import com.codeheadsystems.entitystore.expression.UpdateExpressionBuilder;
import com.codeheadsystems.entitystore.helper.CapabilityInjector;
import com.codeheadsystems.entitystore.manager.BatchWriter;
import com.codeheadsystems.entitystore.manager.ItemAccessor;
import com.codeheadsystems.entitystore.manager.QueryEngine;
import com.codeheadsystems.entitystore.manager.ScanEngine;
import com.codeheadsystems.entitystore.model.Entity;
import com.codeheadsystems.entitystore.model.EntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.TableDefinition;
import com.codeheadsystems.entitystore.util.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Builds the engines and repositories for an entity type and table.
 */
@Singleton
public class RepositoryFactory {

  private static final Logger log = LoggerFactory.getLogger(RepositoryFactory.class);

  private final DynamoDbClient dynamoDbClient;
  private final ObjectMapper objectMapper;
  private final AttributeValueConverter attributeValueConverter;
  private final UpdateExpressionBuilder updateExpressionBuilder;
  private final KeyBuilder keyBuilder;
  private final CapabilityInjector capabilityInjector;
  private final EntityStoreConfiguration configuration;
  private final Sleeper sleeper;

  /**
   * Instantiates a new Repository factory.
   *
   * @param dynamoDbClient          the dynamo db client
   * @param objectMapper            the object mapper
   * @param attributeValueConverter the attribute value converter
   * @param updateExpressionBuilder the update expression builder
   * @param keyBuilder              the key builder
   * @param capabilityInjector      the capability injector
   * @param configuration           the configuration
   * @param sleeper                 the sleeper
   */
  @Inject
  public RepositoryFactory(final DynamoDbClient dynamoDbClient,
                           final ObjectMapper objectMapper,
                           final AttributeValueConverter attributeValueConverter,
                           final UpdateExpressionBuilder updateExpressionBuilder,
                           final KeyBuilder keyBuilder,
                           final CapabilityInjector capabilityInjector,
                           final EntityStoreConfiguration configuration,
                           final Sleeper sleeper) {
    log.info("RepositoryFactory({}, {})", dynamoDbClient, configuration);
    this.dynamoDbClient = dynamoDbClient;
    this.objectMapper = objectMapper;
    this.attributeValueConverter = attributeValueConverter;
    this.updateExpressionBuilder = updateExpressionBuilder;
    this.keyBuilder = keyBuilder;
    this.capabilityInjector = capabilityInjector;
    this.configuration = configuration;
    this.sleeper = sleeper;
  }

  /**
   * The engines for an entity type stored in a table.
   *
   * @param entityClass the entity class
   * @param tableName   the table name
   * @param <T>         the entity type
   * @return the entity table
   */
  public <T extends Entity> EntityTable<T> table(final Class<T> entityClass, final String tableName) {
    log.trace("table({}, {})", entityClass.getSimpleName(), tableName);
    final EntityCodec<T> codec = new EntityCodec<>(objectMapper, attributeValueConverter, entityClass,
        TableDefinition.DEFAULT_HASH_KEY);
    return new EntityTable<>(tableName,
        codec,
        new ItemAccessor<>(dynamoDbClient, codec, updateExpressionBuilder, tableName),
        new BatchWriter<>(dynamoDbClient, codec, configuration, sleeper, tableName),
        new QueryEngine<>(dynamoDbClient, codec, tableName),
        new ScanEngine<>(dynamoDbClient, codec, tableName));
  }

  /**
   * A plain repository for an entity type stored in a table.
   *
   * @param entityClass the entity class
   * @param tableName   the table name
   * @param <T>         the entity type
   * @return the repository
   */
  public <T extends Entity> Repository<T> create(final Class<T> entityClass, final String tableName) {
    return new BaseRepository<>(table(entityClass, tableName), keyBuilder, capabilityInjector);
  }

  /**
   * Key builder shared by the repositories.
   *
   * @return the key builder
   */
  public KeyBuilder keyBuilder() {
    return keyBuilder;
  }

  /**
   * Capability injector shared by the repositories.
   *
   * @return the capability injector
   */
  public CapabilityInjector capabilityInjector() {
    return capabilityInjector;
  }
}
