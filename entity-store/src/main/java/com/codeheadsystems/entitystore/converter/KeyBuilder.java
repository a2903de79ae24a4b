package com.codeheadsystems.entitystore.converter;

import com.codeheadsystems.entitystore.exception.EncodingException;
import com.codeheadsystems.entitystore.model.Entity;
import com.codeheadsystems.entitystore.model.TableDefinition;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Builds the primary keys items are stored under.
 */
@Singleton
public class KeyBuilder {

  private static final Logger log = LoggerFactory.getLogger(KeyBuilder.class);

  private final AttributeValueConverter attributeValueConverter;

  /**
   * Instantiates a new Key builder.
   *
   * @param attributeValueConverter the attribute value converter
   */
  @Inject
  public KeyBuilder(final AttributeValueConverter attributeValueConverter) {
    log.info("KeyBuilder({})", attributeValueConverter);
    this.attributeValueConverter = attributeValueConverter;
  }

  /**
   * Key of a single partition key table.
   *
   * @param id the id
   * @return {"id": id}
   */
  public Map<String, AttributeValue> simpleKey(final String id) {
    log.trace("simpleKey({})", id);
    if (id == null) {
      throw new EncodingException("Key id cannot be null");
    }
    return Map.of(TableDefinition.DEFAULT_HASH_KEY, AttributeValue.builder().s(id).build());
  }

  /**
   * Key of an entity in a single partition key table.
   *
   * @param entity the entity
   * @return the key
   */
  public Map<String, AttributeValue> keyFor(final Entity entity) {
    return simpleKey(entity.getId());
  }

  /**
   * Key of a partition plus sort key table. Both values must be strings or numbers.
   *
   * @param partitionName  the partition attribute
   * @param sortName       the sort attribute
   * @param partitionValue the partition value
   * @param sortValue      the sort value
   * @return the key
   */
  public Map<String, AttributeValue> compositeKey(final String partitionName,
                                                  final String sortName,
                                                  final Object partitionValue,
                                                  final Object sortValue) {
    log.trace("compositeKey({}, {}, {}, {})", partitionName, sortName, partitionValue, sortValue);
    final Map<String, AttributeValue> key = new LinkedHashMap<>();
    key.put(partitionName, attributeValueConverter.toScalar(partitionValue));
    key.put(sortName, attributeValueConverter.toScalar(sortValue));
    return key;
  }
}
