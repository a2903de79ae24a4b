package com.codeheadsystems.entitystore.converter;

import com.codeheadsystems.entitystore.exception.DecodingException;
import com.codeheadsystems.entitystore.exception.EncodingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Marshals one entity type to and from DynamoDB items through its Jackson mapping.
 *
 * @param <T> the entity type
 */
public class EntityCodec<T> {

  private static final Logger log = LoggerFactory.getLogger(EntityCodec.class);

  private final ObjectMapper objectMapper;
  private final AttributeValueConverter attributeValueConverter;
  private final Class<T> entityClass;
  private final String requiredAttribute;

  /**
   * Instantiates a new Entity codec.
   *
   * @param objectMapper            the object mapper
   * @param attributeValueConverter the attribute value converter
   * @param entityClass             the entity class
   * @param requiredAttribute       the attribute every stored item must carry, the partition key
   */
  public EntityCodec(final ObjectMapper objectMapper,
                     final AttributeValueConverter attributeValueConverter,
                     final Class<T> entityClass,
                     final String requiredAttribute) {
    log.info("EntityCodec({}, {})", entityClass.getSimpleName(), requiredAttribute);
    this.objectMapper = objectMapper;
    this.attributeValueConverter = attributeValueConverter;
    this.entityClass = entityClass;
    this.requiredAttribute = requiredAttribute;
  }

  /**
   * The entity class.
   *
   * @return the class
   */
  public Class<T> entityClass() {
    return entityClass;
  }

  /**
   * Marshal an entity to an item.
   *
   * @param entity the entity
   * @return the item
   */
  public Map<String, AttributeValue> marshal(final T entity) {
    log.trace("marshal({})", entity);
    final JsonNode node;
    try {
      node = objectMapper.valueToTree(entity);
    } catch (IllegalArgumentException e) {
      throw new EncodingException("Unable to encode " + entityClass.getSimpleName(), e);
    }
    if (node == null || !node.isObject()) {
      throw new EncodingException(entityClass.getSimpleName() + " does not encode to an object");
    }
    return attributeValueConverter.toItem((ObjectNode) node);
  }

  /**
   * Unmarshal an item to an entity.
   *
   * @param item the item
   * @return the entity
   */
  public T unmarshal(final Map<String, AttributeValue> item) {
    log.trace("unmarshal({})", item);
    if (requiredAttribute != null && !item.containsKey(requiredAttribute)) {
      throw new DecodingException("Item is missing required attribute " + requiredAttribute);
    }
    try {
      return objectMapper.treeToValue(attributeValueConverter.toObjectNode(item), entityClass);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DecodingException("Unable to decode " + entityClass.getSimpleName(), e);
    }
  }

  /**
   * Unmarshal a projected item, where the required attribute may have been left out.
   *
   * @param item the item
   * @return the entity
   */
  public T unmarshalProjection(final Map<String, AttributeValue> item) {
    log.trace("unmarshalProjection({})", item);
    try {
      return objectMapper.treeToValue(attributeValueConverter.toObjectNode(item), entityClass);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DecodingException("Unable to decode " + entityClass.getSimpleName(), e);
    }
  }
}
