package com.codeheadsystems.entitystore.repository;

import com.codeheadsystems.entitystore.model.Entity;
import com.codeheadsystems.entitystore.model.PageResult;
import com.codeheadsystems.entitystore.model.QuerySpec;
import com.codeheadsystems.entitystore.model.ScanSpec;
import com.codeheadsystems.entitystore.model.UpdateOptions;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD, query, scan and batch operations for one entity type stored in one table.
 *
 * @param <T> the entity type
 */
public interface Repository<T extends Entity> {

  /**
   * The table backing this repository.
   *
   * @return the table name
   */
  String tableName();

  /**
   * Save an entity, overwriting any item with the same id. Stamps timestamps and sets the
   * version to 1.
   *
   * @param entity the entity
   */
  void save(T entity);

  /**
   * Save many entities with batch writes.
   *
   * @param entities the entities
   * @return how many were written
   */
  int saveBatch(List<T> entities);

  /**
   * Save an entity only if no item has its id.
   *
   * @param entity the entity
   */
  void saveIfNotExists(T entity);

  /**
   * Find by id with an eventually consistent read.
   *
   * @param id the id
   * @return the entity if found
   */
  Optional<T> findById(String id);

  /**
   * Find by id with a strongly consistent read.
   *
   * @param id the id
   * @return the entity if found
   */
  Optional<T> findByIdConsistent(String id);

  /**
   * Whether an entity with the id can be found. Reads the whole item.
   *
   * @param id the id
   * @return true if found
   */
  boolean exists(String id);

  /**
   * Delete an entity.
   *
   * @param entity the entity
   */
  void delete(T entity);

  /**
   * Delete by id.
   *
   * @param id the id
   */
  void deleteById(String id);

  /**
   * Update attributes of an entity. Adds the update instant and the next version. The entity
   * itself is not changed.
   *
   * @param entity  the entity, read for its key and version
   * @param options the update
   * @return the updated entity when asked for
   */
  Optional<T> update(T entity, UpdateOptions options);

  /**
   * Update attributes by id. Adds the update instant if the entity type is timestamped; the
   * version is left alone.
   *
   * @param id      the id
   * @param options the update
   * @return the updated entity when asked for
   */
  Optional<T> updateById(String id, UpdateOptions options);

  /**
   * Update only if the stored version is still the entity's version.
   *
   * @param entity  a versioned entity
   * @param updates the attributes to set
   * @return the updated entity
   */
  T updateWithOptimisticLock(T entity, Map<String, Object> updates);

  /**
   * Query, following every page.
   *
   * @param spec the query spec
   * @return the entities
   */
  List<T> query(QuerySpec spec);

  /**
   * Query one page.
   *
   * @param spec the query spec
   * @return the page
   */
  PageResult<T> queryWithPaging(QuerySpec spec);

  /**
   * Count the items a query matches.
   *
   * @param spec the query spec
   * @return the count
   */
  long count(QuerySpec spec);

  /**
   * Scan, following every page.
   *
   * @param spec the scan spec
   * @return the entities
   */
  List<T> scan(ScanSpec spec);

  /**
   * Scan one page.
   *
   * @param spec the scan spec
   * @return the page
   */
  PageResult<T> scanWithPaging(ScanSpec spec);

  /**
   * Every entity in the table.
   *
   * @return the entities
   */
  List<T> scanAll();

}
