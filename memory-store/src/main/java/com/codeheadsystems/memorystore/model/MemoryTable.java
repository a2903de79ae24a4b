package com.codeheadsystems.memorystore.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * A table held in memory: its create request, the key schema of the table and its indexes, and
 * the items keyed by their primary key.
 */
public class MemoryTable {

  private final CreateTableRequest definition;
  private final KeyDefinition primaryKey;
  private final Map<String, KeyDefinition> indexes;
  private final ConcurrentSkipListMap<String, Map<String, AttributeValue>> items;
  private final AtomicInteger creatingDescribes;

  /**
   * Instantiates a new Memory table.
   *
   * @param definition        the create request the table came from
   * @param creatingDescribes how many describe calls report CREATING before ACTIVE
   */
  public MemoryTable(final CreateTableRequest definition, final int creatingDescribes) {
    this.definition = definition;
    this.primaryKey = KeyDefinition.from(definition.keySchema());
    final Map<String, KeyDefinition> indexMap = new HashMap<>();
    definition.globalSecondaryIndexes().forEach(gsi -> indexMap.put(gsi.indexName(), KeyDefinition.from(gsi.keySchema())));
    definition.localSecondaryIndexes().forEach(lsi -> indexMap.put(lsi.indexName(), KeyDefinition.from(lsi.keySchema())));
    this.indexes = Collections.unmodifiableMap(indexMap);
    this.items = new ConcurrentSkipListMap<>();
    this.creatingDescribes = new AtomicInteger(creatingDescribes);
  }

  /**
   * Name of the table.
   *
   * @return the name
   */
  public String name() {
    return definition.tableName();
  }

  /**
   * Primary key definition.
   *
   * @return the key definition
   */
  public KeyDefinition primaryKey() {
    return primaryKey;
  }

  /**
   * Key definition of a secondary index.
   *
   * @param indexName the index name
   * @return the key definition if the index exists
   */
  public Optional<KeyDefinition> index(final String indexName) {
    return Optional.ofNullable(indexes.get(indexName));
  }

  /**
   * The live item storage, ordered by primary key.
   *
   * @return the items
   */
  public ConcurrentSkipListMap<String, Map<String, AttributeValue>> items() {
    return items;
  }

  /**
   * Builds the storage key for an item or key map.
   *
   * @param attributes the attributes holding at least the primary key
   * @return the storage key
   */
  public String storageKey(final Map<String, AttributeValue> attributes) {
    final AttributeValue hash = attributes.get(primaryKey.hashKey());
    if (hash == null) {
      throw new IllegalArgumentException("Missing hash key attribute: " + primaryKey.hashKey());
    }
    final StringBuilder builder = new StringBuilder(render(hash));
    primaryKey.sortKey().ifPresent(sortKey -> {
      final AttributeValue sort = attributes.get(sortKey);
      if (sort == null) {
        throw new IllegalArgumentException("Missing sort key attribute: " + sortKey);
      }
      builder.append('\u0000').append(render(sort));
    });
    return builder.toString();
  }

  /**
   * Extracts the primary key attributes of an item.
   *
   * @param item the item
   * @return the key map
   */
  public Map<String, AttributeValue> keyOf(final Map<String, AttributeValue> item) {
    final Map<String, AttributeValue> key = new LinkedHashMap<>();
    key.put(primaryKey.hashKey(), item.get(primaryKey.hashKey()));
    primaryKey.sortKey().ifPresent(sortKey -> key.put(sortKey, item.get(sortKey)));
    return key;
  }

  /**
   * Describes the table. The first configured number of calls report CREATING.
   *
   * @return the description
   */
  public TableDescription describe() {
    final TableStatus status = creatingDescribes.getAndUpdate(i -> Math.max(0, i - 1)) > 0
        ? TableStatus.CREATING : TableStatus.ACTIVE;
    return describeAs(status);
  }

  /**
   * Describes the table with a fixed status.
   *
   * @param status the status to report
   * @return the description
   */
  public TableDescription describeAs(final TableStatus status) {
    return TableDescription.builder()
        .tableName(definition.tableName())
        .keySchema(definition.keySchema())
        .attributeDefinitions(definition.attributeDefinitions())
        .tableStatus(status)
        .itemCount((long) items.size())
        .build();
  }

  private String render(final AttributeValue value) {
    if (value.s() != null) {
      return "S:" + value.s();
    }
    if (value.n() != null) {
      return "N:" + value.n();
    }
    if (value.b() != null) {
      return "B:" + value.b().asUtf8String();
    }
    throw new IllegalArgumentException("Key attributes must be S, N or B: " + value);
  }

  /**
   * The hash and optional sort key of a table or index.
   */
  public static class KeyDefinition {

    private final String hashKey;
    private final String sortKey;

    /**
     * Instantiates a new Key definition.
     *
     * @param hashKey the hash key
     * @param sortKey the sort key, may be null
     */
    public KeyDefinition(final String hashKey, final String sortKey) {
      this.hashKey = hashKey;
      this.sortKey = sortKey;
    }

    /**
     * Reads a key schema.
     *
     * @param keySchema the key schema
     * @return the key definition
     */
    public static KeyDefinition from(final List<KeySchemaElement> keySchema) {
      String hash = null;
      String sort = null;
      for (KeySchemaElement element : keySchema) {
        if (element.keyType() == KeyType.HASH) {
          hash = element.attributeName();
        } else if (element.keyType() == KeyType.RANGE) {
          sort = element.attributeName();
        }
      }
      if (hash == null) {
        throw new IllegalArgumentException("Key schema has no HASH key: " + keySchema);
      }
      return new KeyDefinition(hash, sort);
    }

    /**
     * Hash key name.
     *
     * @return the name
     */
    public String hashKey() {
      return hashKey;
    }

    /**
     * Sort key name.
     *
     * @return the name if the key has a sort key
     */
    public Optional<String> sortKey() {
      return Optional.ofNullable(sortKey);
    }
  }
}
