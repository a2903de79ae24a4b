package com.codeheadsystems.entitystore.helper;

import com.codeheadsystems.entitystore.model.Timestamped;
import com.codeheadsystems.entitystore.model.Versioned;
import java.time.Clock;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the optional entity capabilities. Each call checks whether the entity is
 * {@link Timestamped} or {@link Versioned} and does nothing for the capabilities it lacks.
 */
@Singleton
public class CapabilityInjector {

  /**
   * Attribute holding the update instant.
   */
  public static final String UPDATED_AT = "updatedAt";
  /**
   * Attribute holding the version.
   */
  public static final String VERSION = "version";

  private static final Logger log = LoggerFactory.getLogger(CapabilityInjector.class);

  private final Clock clock;

  /**
   * Instantiates a new Capability injector.
   *
   * @param clock the clock
   */
  @Inject
  public CapabilityInjector(final Clock clock) {
    log.info("CapabilityInjector({})", clock);
    this.clock = clock;
  }

  /**
   * Current time in epoch seconds.
   *
   * @return the now
   */
  public long now() {
    return clock.instant().getEpochSecond();
  }

  /**
   * Prepares an entity for a full put. Creation and update instants are both set to now, even
   * when the put overwrites an existing item, and the version starts at 1.
   *
   * @param entity the entity
   */
  public void beforeSave(final Object entity) {
    log.trace("beforeSave({})", entity);
    if (entity instanceof Timestamped) {
      final Timestamped timestamped = (Timestamped) entity;
      final long now = now();
      timestamped.setCreatedAt(now);
      timestamped.setUpdatedAt(now);
    }
    if (entity instanceof Versioned) {
      ((Versioned) entity).setVersion(1L);
    }
  }

  /**
   * Adds the update instant and the next version to the assignments of an update.
   *
   * @param entity      the entity being updated, read for its current version
   * @param assignments the assignments to add to
   */
  public void beforeUpdate(final Object entity, final Map<String, Object> assignments) {
    log.trace("beforeUpdate({}, {})", entity, assignments);
    if (entity instanceof Timestamped) {
      assignments.put(UPDATED_AT, now());
    }
    if (entity instanceof Versioned) {
      assignments.put(VERSION, currentVersion((Versioned) entity) + 1);
    }
  }

  /**
   * Adds the update instant for an update by id, where only the entity type is known.
   *
   * @param entityClass the entity class
   * @param assignments the assignments to add to
   */
  public void beforeUpdate(final Class<?> entityClass, final Map<String, Object> assignments) {
    log.trace("beforeUpdate({}, {})", entityClass.getSimpleName(), assignments);
    if (Timestamped.class.isAssignableFrom(entityClass)) {
      assignments.put(UPDATED_AT, now());
    }
  }

  /**
   * The version an entity currently holds, 0 when it has none yet.
   *
   * @param versioned the entity
   * @return the version
   */
  public long currentVersion(final Versioned versioned) {
    return versioned.getVersion() == null ? 0L : versioned.getVersion();
  }
}
