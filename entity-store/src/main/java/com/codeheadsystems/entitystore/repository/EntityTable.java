package com.codeheadsystems.entitystore.repository;

import com.codeheadsystems.entitystore.converter.EntityCodec;
import com.codeheadsystems.entitystore.manager.BatchWriter;
import com.codeheadsystems.entitystore.manager.ItemAccessor;
import com.codeheadsystems.entitystore.manager.QueryEngine;
import com.codeheadsystems.entitystore.manager.ScanEngine;

/**
 * The engines bound to one entity type and one table.
 *
 * @param <T> the entity type
 */
public class EntityTable<T> {

  private final String tableName;
  private final EntityCodec<T> entityCodec;
  private final ItemAccessor<T> itemAccessor;
  private final BatchWriter<T> batchWriter;
  private final QueryEngine<T> queryEngine;
  private final ScanEngine<T> scanEngine;

  /**
   * Instantiates a new Entity table.
   *
   * @param tableName    the table name
   * @param entityCodec  the entity codec
   * @param itemAccessor the item accessor
   * @param batchWriter  the batch writer
   * @param queryEngine  the query engine
   * @param scanEngine   the scan engine
   */
  public EntityTable(final String tableName,
                     final EntityCodec<T> entityCodec,
                     final ItemAccessor<T> itemAccessor,
                     final BatchWriter<T> batchWriter,
                     final QueryEngine<T> queryEngine,
                     final ScanEngine<T> scanEngine) {
    this.tableName = tableName;
    this.entityCodec = entityCodec;
    this.itemAccessor = itemAccessor;
    this.batchWriter = batchWriter;
    this.queryEngine = queryEngine;
    this.scanEngine = scanEngine;
  }

  public String tableName() {
    return tableName;
  }

  public EntityCodec<T> entityCodec() {
    return entityCodec;
  }

  public ItemAccessor<T> itemAccessor() {
    return itemAccessor;
  }

  public BatchWriter<T> batchWriter() {
    return batchWriter;
  }

  public QueryEngine<T> queryEngine() {
    return queryEngine;
  }

  public ScanEngine<T> scanEngine() {
    return scanEngine;
  }
}
