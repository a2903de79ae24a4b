package com.codeheadsystems.memorystore.manager;

import com.codeheadsystems.memorystore.model.MemoryTable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Registry of the in-memory tables.
 */
public class MemoryTableManager {

  private static final Logger log = LoggerFactory.getLogger(MemoryTableManager.class);

  private final Map<String, MemoryTable> tables;
  private final int creatingDescribes;

  /**
   * Instantiates a new Memory table manager.
   *
   * @param creatingDescribes how many describe calls of a new table report CREATING
   */
  public MemoryTableManager(final int creatingDescribes) {
    log.info("MemoryTableManager({})", creatingDescribes);
    this.tables = new ConcurrentHashMap<>();
    this.creatingDescribes = creatingDescribes;
  }

  /**
   * Insert a table.
   *
   * @param request the create request
   * @return the table if it was created, empty if the name was taken
   */
  public Optional<MemoryTable> insertTable(final CreateTableRequest request) {
    log.trace("insertTable({})", request.tableName());
    final MemoryTable table = new MemoryTable(request, creatingDescribes);
    final MemoryTable existing = tables.putIfAbsent(request.tableName(), table);
    if (existing != null) {
      log.warn("Table {} already exists", request.tableName());
      return Optional.empty();
    }
    return Optional.of(table);
  }

  /**
   * Get a table.
   *
   * @param tableName the table name
   * @return the table, if present
   */
  public Optional<MemoryTable> getTable(final String tableName) {
    log.trace("getTable({})", tableName);
    return Optional.ofNullable(tables.get(tableName));
  }

  /**
   * Get a table or fail the way the service does.
   *
   * @param tableName the table name
   * @return the table
   */
  public MemoryTable requireTable(final String tableName) {
    return getTable(tableName).orElseThrow(() -> ResourceNotFoundException.builder()
        .message("Requested resource not found: Table: " + tableName + " not found")
        .build());
  }

  /**
   * Delete a table.
   *
   * @param tableName the table name
   * @return the removed table, if it existed
   */
  public Optional<MemoryTable> deleteTable(final String tableName) {
    log.trace("deleteTable({})", tableName);
    return Optional.ofNullable(tables.remove(tableName));
  }

  /**
   * List the table names, sorted.
   *
   * @return the names
   */
  public List<String> listTables() {
    log.trace("listTables()");
    return tables.keySet().stream().sorted().collect(Collectors.toList());
  }
}
