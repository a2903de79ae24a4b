package com.codeheadsystems.entitystore.repository;

import com.codeheadsystems.entitystore.converter.KeyBuilder;
import com.codeheadsystems.entitystore.helper.CapabilityInjector;
import com.codeheadsystems.entitystore.model.Entity;
import com.codeheadsystems.entitystore.model.ImmutableScanSpec;
import com.codeheadsystems.entitystore.model.ImmutableUpdateOptions;
import com.codeheadsystems.entitystore.model.PageResult;
import com.codeheadsystems.entitystore.model.QuerySpec;
import com.codeheadsystems.entitystore.model.ScanSpec;
import com.codeheadsystems.entitystore.model.UpdateOptions;
import com.codeheadsystems.entitystore.model.Versioned;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Repository over an {@link EntityTable}. Entity specific repositories extend this and add
 * their finders.
 *
 * @param <T> the entity type
 */
public class BaseRepository<T extends Entity> implements Repository<T> {

  private static final Logger log = LoggerFactory.getLogger(BaseRepository.class);

  private static final String NOT_EXISTS = "attribute_not_exists(#id)";
  private static final String VERSION_MATCHES = "#version = :expectedVersion";

  private final EntityTable<T> table;
  private final KeyBuilder keyBuilder;
  private final CapabilityInjector capabilityInjector;

  /**
   * Instantiates a new Base repository.
   *
   * @param table              the table
   * @param keyBuilder         the key builder
   * @param capabilityInjector the capability injector
   */
  public BaseRepository(final EntityTable<T> table,
                        final KeyBuilder keyBuilder,
                        final CapabilityInjector capabilityInjector) {
    log.info("BaseRepository({})", table.tableName());
    this.table = table;
    this.keyBuilder = keyBuilder;
    this.capabilityInjector = capabilityInjector;
  }

  /**
   * The engines of this repository, for subclasses.
   *
   * @return the table
   */
  protected EntityTable<T> table() {
    return table;
  }

  @Override
  public String tableName() {
    return table.tableName();
  }

  @Override
  public void save(final T entity) {
    log.trace("save({})", entity.getId());
    capabilityInjector.beforeSave(entity);
    table.itemAccessor().put(entity);
  }

  @Override
  public int saveBatch(final List<T> entities) {
    log.trace("saveBatch({})", entities.size());
    entities.forEach(capabilityInjector::beforeSave);
    return table.batchWriter().writeAll(entities);
  }

  @Override
  public void saveIfNotExists(final T entity) {
    log.trace("saveIfNotExists({})", entity.getId());
    capabilityInjector.beforeSave(entity);
    table.itemAccessor().put(entity, NOT_EXISTS, Map.of("#id", "id"), Map.of());
  }

  @Override
  public Optional<T> findById(final String id) {
    log.trace("findById({})", id);
    return table.itemAccessor().get(keyBuilder.simpleKey(id), false);
  }

  @Override
  public Optional<T> findByIdConsistent(final String id) {
    log.trace("findByIdConsistent({})", id);
    return table.itemAccessor().get(keyBuilder.simpleKey(id), true);
  }

  @Override
  public boolean exists(final String id) {
    return findById(id).isPresent();
  }

  @Override
  public void delete(final T entity) {
    log.trace("delete({})", entity.getId());
    table.itemAccessor().delete(keyBuilder.keyFor(entity));
  }

  @Override
  public void deleteById(final String id) {
    log.trace("deleteById({})", id);
    table.itemAccessor().delete(keyBuilder.simpleKey(id));
  }

  @Override
  public Optional<T> update(final T entity, final UpdateOptions options) {
    log.trace("update({}, {})", entity.getId(), options);
    final Map<String, Object> assignments = new HashMap<>(options.assignments());
    capabilityInjector.beforeUpdate(entity, assignments);
    return table.itemAccessor().update(keyBuilder.keyFor(entity),
        ImmutableUpdateOptions.copyOf(options).withAssignments(assignments));
  }

  @Override
  public Optional<T> updateById(final String id, final UpdateOptions options) {
    log.trace("updateById({}, {})", id, options);
    final Map<String, Object> assignments = new HashMap<>(options.assignments());
    capabilityInjector.beforeUpdate(table.entityCodec().entityClass(), assignments);
    return table.itemAccessor().update(keyBuilder.simpleKey(id),
        ImmutableUpdateOptions.copyOf(options).withAssignments(assignments));
  }

  @Override
  public T updateWithOptimisticLock(final T entity, final Map<String, Object> updates) {
    log.trace("updateWithOptimisticLock({}, {})", entity.getId(), updates);
    if (!(entity instanceof Versioned)) {
      throw new IllegalArgumentException(entity.getClass().getSimpleName() + " is not versioned");
    }
    final long expected = capabilityInjector.currentVersion((Versioned) entity);
    final Map<String, Object> assignments = new HashMap<>(updates);
    capabilityInjector.beforeUpdate(entity, assignments);
    final UpdateOptions options = ImmutableUpdateOptions.builder()
        .assignments(assignments)
        .conditionExpression(VERSION_MATCHES)
        .putExpressionAttributeNames("#version", CapabilityInjector.VERSION)
        .putExpressionAttributeValues(":expectedVersion", AttributeValue.builder().n(Long.toString(expected)).build())
        .returnUpdated(true)
        .build();
    return table.itemAccessor().update(keyBuilder.keyFor(entity), options)
        .orElseThrow(() -> new IllegalStateException("Update of " + entity.getId() + " returned no item"));
  }

  @Override
  public List<T> query(final QuerySpec spec) {
    return table.queryEngine().query(spec);
  }

  @Override
  public PageResult<T> queryWithPaging(final QuerySpec spec) {
    return table.queryEngine().queryPage(spec);
  }

  @Override
  public long count(final QuerySpec spec) {
    return table.queryEngine().count(spec);
  }

  @Override
  public List<T> scan(final ScanSpec spec) {
    return table.scanEngine().scanAll(spec);
  }

  @Override
  public PageResult<T> scanWithPaging(final ScanSpec spec) {
    return table.scanEngine().scanPage(spec);
  }

  @Override
  public List<T> scanAll() {
    return table.scanEngine().scanAll(ImmutableScanSpec.builder().build());
  }
}
