package com.codeheadsystems.entitystore.manager;

import com.codeheadsystems.entitystore.exception.OperationCancelledException;
import com.codeheadsystems.entitystore.exception.TableUnavailableException;
import com.codeheadsystems.entitystore.model.EntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.TableDefinition;
import com.codeheadsystems.entitystore.util.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Creates tables on demand and waits for them to become active.
 */
@Singleton
public class TableManager {

  private static final Logger log = LoggerFactory.getLogger(TableManager.class);

  private final DynamoDbClient dynamoDbClient;
  private final EntityStoreConfiguration configuration;
  private final Sleeper sleeper;
  private final Clock clock;

  /**
   * Instantiates a new Table manager.
   *
   * @param dynamoDbClient the dynamo db client
   * @param configuration  the configuration
   * @param sleeper        the sleeper
   * @param clock          the clock
   */
  @Inject
  public TableManager(final DynamoDbClient dynamoDbClient,
                      final EntityStoreConfiguration configuration,
                      final Sleeper sleeper,
                      final Clock clock) {
    log.info("TableManager({}, {}, {}, {})", dynamoDbClient, configuration, sleeper, clock);
    this.dynamoDbClient = dynamoDbClient;
    this.configuration = configuration;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  /**
   * Make sure the table exists and is active, creating it when the store does not know it.
   *
   * @param definition the definition used if the table has to be created
   */
  public void ensureTable(final TableDefinition definition) {
    log.trace("ensureTable({})", definition.tableName());
    final TableStatus status;
    try {
      status = describe(definition.tableName());
    } catch (ResourceNotFoundException e) {
      log.info("Table {} not found, creating it", definition.tableName());
      createTable(definition);
      return;
    } catch (SdkException e) {
      log.error("Unable to describe table {}", definition.tableName(), e);
      throw new TableUnavailableException("Unable to describe table " + definition.tableName(), e);
    }
    if (status != TableStatus.ACTIVE) {
      waitForActive(definition.tableName());
    }
  }

  /**
   * Create the table and wait for it to become active. A table created concurrently by someone
   * else counts as success.
   *
   * @param definition the definition
   */
  public void createTable(final TableDefinition definition) {
    log.trace("createTable({})", definition);
    final CreateTableRequest.Builder builder = CreateTableRequest.builder()
        .tableName(definition.tableName())
        .attributeDefinitions(definition.attributeDefinitions())
        .keySchema(definition.keySchema())
        .billingMode(definition.billingMode());
    if (!definition.globalSecondaryIndexes().isEmpty()) {
      builder.globalSecondaryIndexes(definition.globalSecondaryIndexes());
    }
    if (!definition.localSecondaryIndexes().isEmpty()) {
      builder.localSecondaryIndexes(definition.localSecondaryIndexes());
    }
    if (definition.billingMode() == BillingMode.PROVISIONED) {
      definition.provisionedThroughput().ifPresent(builder::provisionedThroughput);
    } else if (definition.provisionedThroughput().isPresent()) {
      log.warn("Ignoring provisioned throughput of {} billed {}", definition.tableName(), definition.billingMode());
    }
    try {
      dynamoDbClient.createTable(builder.build());
      log.info("Created table {}", definition.tableName());
    } catch (ResourceInUseException e) {
      log.info("Table {} already exists", definition.tableName());
    } catch (SdkException e) {
      log.error("Unable to create table {}", definition.tableName(), e);
      throw new TableUnavailableException("Unable to create table " + definition.tableName(), e);
    }
    waitForActive(definition.tableName());
  }

  /**
   * Does the table exist.
   *
   * @param tableName the table name
   * @return true if the store describes it
   */
  public boolean tableExists(final String tableName) {
    log.trace("tableExists({})", tableName);
    try {
      describe(tableName);
      return true;
    } catch (ResourceNotFoundException e) {
      return false;
    }
  }

  /**
   * Delete a table.
   *
   * @param tableName the table name
   * @return true if it was deleted, false if it did not exist
   */
  public boolean deleteTable(final String tableName) {
    log.trace("deleteTable({})", tableName);
    try {
      dynamoDbClient.deleteTable(DeleteTableRequest.builder().tableName(tableName).build());
      log.info("Deleted table {}", tableName);
      return true;
    } catch (ResourceNotFoundException e) {
      log.warn("Table {} not found for delete", tableName);
      return false;
    }
  }

  private TableStatus describe(final String tableName) {
    return dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build())
        .table()
        .tableStatus();
  }

  private void waitForActive(final String tableName) {
    final Instant deadline = clock.instant().plus(Duration.ofSeconds(configuration.tableActiveTimeoutSeconds()));
    while (true) {
      try {
        final TableStatus status = describe(tableName);
        if (status == TableStatus.ACTIVE) {
          log.info("Table {} is active", tableName);
          return;
        }
        log.debug("Table {} is {}", tableName, status);
      } catch (ResourceNotFoundException e) {
        log.debug("Table {} not visible yet", tableName);
      } catch (SdkException e) {
        log.error("Unable to describe table {} while waiting", tableName, e);
        throw new TableUnavailableException("Unable to describe table " + tableName, e);
      }
      if (!clock.instant().isBefore(deadline)) {
        log.error("Table {} not active after {}s", tableName, configuration.tableActiveTimeoutSeconds());
        throw new TableUnavailableException("Table " + tableName + " did not become active in time");
      }
      try {
        sleeper.sleep(configuration.tablePollIntervalMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new OperationCancelledException("Interrupted waiting for table " + tableName, e);
      }
    }
  }
}
