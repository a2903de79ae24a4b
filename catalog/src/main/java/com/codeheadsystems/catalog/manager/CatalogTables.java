package com.codeheadsystems.catalog.manager;

import com.codeheadsystems.catalog.repository.BrandRepository;
import com.codeheadsystems.catalog.repository.CategoryRepository;
import com.codeheadsystems.catalog.repository.ProductRepository;
import com.codeheadsystems.entitystore.manager.TableManager;
import com.codeheadsystems.entitystore.model.TableDefinition;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstraps the catalog tables. Call once at startup, before the repositories are used.
 */
@Singleton
public class CatalogTables {

  /**
   * Every catalog table, created with the default schema.
   */
  public static final List<String> TABLE_NAMES = List.of(
      ProductRepository.TABLE_NAME, BrandRepository.TABLE_NAME, CategoryRepository.TABLE_NAME);

  private static final Logger log = LoggerFactory.getLogger(CatalogTables.class);

  private final TableManager tableManager;

  /**
   * Instantiates a new Catalog tables.
   *
   * @param tableManager the table manager
   */
  @Inject
  public CatalogTables(final TableManager tableManager) {
    log.info("CatalogTables({})", tableManager);
    this.tableManager = tableManager;
  }

  /**
   * Create the missing tables and wait until all are active.
   */
  public void ensureAll() {
    log.trace("ensureAll()");
    TABLE_NAMES.forEach(name -> tableManager.ensureTable(TableDefinition.simple(name)));
  }

  /**
   * Drop every catalog table that exists.
   *
   * @return how many tables were dropped
   */
  public int dropAll() {
    log.trace("dropAll()");
    return (int) TABLE_NAMES.stream().filter(tableManager::deleteTable).count();
  }
}
