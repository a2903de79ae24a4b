package com.codeheadsystems.catalog.repository;

import com.codeheadsystems.catalog.model.Product;
import com.codeheadsystems.entitystore.converter.KeyBuilder;
import com.codeheadsystems.entitystore.expression.ExpressionBuilder;
import com.codeheadsystems.entitystore.helper.CapabilityInjector;
import com.codeheadsystems.entitystore.repository.BaseRepository;
import com.codeheadsystems.entitystore.repository.EntityTable;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Products, with finders by category, brand and name.
 *
 * <p>The finders scan the whole table with a filter and return summaries: only id, name,
 * status, categoryId and brandId are populated. Their cost grows with the table, not with the
 * result.
 */
public class ProductRepository extends BaseRepository<Product> {

  /**
   * Table name.
   */
  public static final String TABLE_NAME = "Products";

  private static final Logger log = LoggerFactory.getLogger(ProductRepository.class);
  private static final String[] SUMMARY = {"id", "name", "status", "categoryId", "brandId"};

  /**
   * Instantiates a new Product repository.
   *
   * @param table              the table
   * @param keyBuilder         the key builder
   * @param capabilityInjector the capability injector
   */
  public ProductRepository(final EntityTable<Product> table,
                           final KeyBuilder keyBuilder,
                           final CapabilityInjector capabilityInjector) {
    super(table, keyBuilder, capabilityInjector);
    log.info("ProductRepository({})", table.tableName());
  }

  /**
   * Products in a category.
   *
   * @param categoryId the category id
   * @return the product summaries
   */
  public List<Product> findByCategory(final String categoryId) {
    log.trace("findByCategory({})", categoryId);
    return scan(ExpressionBuilder.builder()
        .equalTo("categoryId", categoryId)
        .project(SUMMARY)
        .buildScanSpec());
  }

  /**
   * Products of a brand.
   *
   * @param brandId the brand id
   * @return the product summaries
   */
  public List<Product> findByBrand(final String brandId) {
    log.trace("findByBrand({})", brandId);
    return scan(ExpressionBuilder.builder()
        .equalTo("brandId", brandId)
        .project(SUMMARY)
        .buildScanSpec());
  }

  /**
   * Products whose name contains the keyword. Case sensitive.
   *
   * @param keyword the keyword
   * @return the product summaries
   */
  public List<Product> searchByName(final String keyword) {
    log.trace("searchByName({})", keyword);
    return scan(ExpressionBuilder.builder()
        .contains("name", keyword)
        .project(SUMMARY)
        .buildScanSpec());
  }
}
