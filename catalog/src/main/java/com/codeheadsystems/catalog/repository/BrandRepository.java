package com.codeheadsystems.catalog.repository;

import com.codeheadsystems.catalog.model.Brand;
import com.codeheadsystems.entitystore.converter.KeyBuilder;
import com.codeheadsystems.entitystore.expression.ExpressionBuilder;
import com.codeheadsystems.entitystore.helper.CapabilityInjector;
import com.codeheadsystems.entitystore.repository.BaseRepository;
import com.codeheadsystems.entitystore.repository.EntityTable;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type Brand repository.
 */
public class BrandRepository extends BaseRepository<Brand> {

  /**
   * Table name.
   */
  public static final String TABLE_NAME = "Brands";

  private static final Logger log = LoggerFactory.getLogger(BrandRepository.class);

  /**
   * Instantiates a new Brand repository.
   *
   * @param table              the table
   * @param keyBuilder         the key builder
   * @param capabilityInjector the capability injector
   */
  public BrandRepository(final EntityTable<Brand> table,
                         final KeyBuilder keyBuilder,
                         final CapabilityInjector capabilityInjector) {
    super(table, keyBuilder, capabilityInjector);
    log.info("BrandRepository({})", table.tableName());
  }

  /**
   * Find by exact name. Scans the table.
   *
   * @param name the name
   * @return every match, names are not unique
   */
  public List<Brand> findByName(final String name) {
    log.trace("findByName({})", name);
    return scan(ExpressionBuilder.builder()
        .equalTo("name", name)
        .buildScanSpec());
  }
}
