package com.codeheadsystems.entitystore.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.LocalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Schema of a table to create.
 */
@Value.Immutable
public interface TableDefinition {

  /**
   * The partition key of tables created with the default schema.
   */
  String DEFAULT_HASH_KEY = "id";

  /**
   * Default schema: string partition key "id", pay per request.
   *
   * @param tableName the table name
   * @return the definition
   */
  static TableDefinition simple(final String tableName) {
    return ImmutableTableDefinition.builder()
        .tableName(tableName)
        .addAttributeDefinitions(AttributeDefinition.builder()
            .attributeName(DEFAULT_HASH_KEY)
            .attributeType(ScalarAttributeType.S)
            .build())
        .addKeySchema(KeySchemaElement.builder()
            .attributeName(DEFAULT_HASH_KEY)
            .keyType(KeyType.HASH)
            .build())
        .build();
  }

  /**
   * Table name.
   *
   * @return the name
   */
  String tableName();

  /**
   * Attribute definitions of every key attribute, indexes included.
   *
   * @return the definitions
   */
  List<AttributeDefinition> attributeDefinitions();

  /**
   * Key schema of the table.
   *
   * @return the key schema
   */
  List<KeySchemaElement> keySchema();

  /**
   * Global secondary indexes.
   *
   * @return the indexes
   */
  List<GlobalSecondaryIndex> globalSecondaryIndexes();

  /**
   * Local secondary indexes.
   *
   * @return the indexes
   */
  List<LocalSecondaryIndex> localSecondaryIndexes();

  /**
   * Billing mode.
   *
   * @return the billing mode
   */
  @Value.Default
  default BillingMode billingMode() {
    return BillingMode.PAY_PER_REQUEST;
  }

  /**
   * Throughput, only sent for provisioned tables.
   *
   * @return the provisioned throughput
   */
  Optional<ProvisionedThroughput> provisionedThroughput();

  /**
   * Provisioned tables need their throughput.
   */
  @Value.Check
  default void check() {
    if (keySchema().isEmpty()) {
      throw new IllegalStateException("Key schema required for " + tableName());
    }
    if (billingMode() == BillingMode.PROVISIONED && provisionedThroughput().isEmpty()) {
      throw new IllegalStateException("Provisioned throughput required for " + tableName());
    }
  }

}
