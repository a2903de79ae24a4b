package com.codeheadsystems.entitystore.converter;

import com.codeheadsystems.entitystore.exception.DecodingException;
import com.codeheadsystems.entitystore.exception.EncodingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Turns continuation cursors into opaque URL-safe tokens and back. A token is Base64 of the
 * type-tagged JSON of the last evaluated key.
 */
@Singleton
public class CursorCodec {

  private static final Logger log = LoggerFactory.getLogger(CursorCodec.class);

  private final ObjectMapper objectMapper;
  private final AttributeValueConverter attributeValueConverter;

  /**
   * Instantiates a new Cursor codec.
   *
   * @param objectMapper            the object mapper
   * @param attributeValueConverter the attribute value converter
   */
  @Inject
  public CursorCodec(final ObjectMapper objectMapper,
                     final AttributeValueConverter attributeValueConverter) {
    log.info("CursorCodec({}, {})", objectMapper, attributeValueConverter);
    this.objectMapper = objectMapper;
    this.attributeValueConverter = attributeValueConverter;
  }

  /**
   * Encodes a cursor.
   *
   * @param lastEvaluatedKey the cursor
   * @return the token, empty when the cursor is empty
   */
  public Optional<String> encode(final Map<String, AttributeValue> lastEvaluatedKey) {
    log.trace("encode({})", lastEvaluatedKey);
    if (lastEvaluatedKey == null || lastEvaluatedKey.isEmpty()) {
      return Optional.empty();
    }
    try {
      final byte[] json = objectMapper.writeValueAsBytes(attributeValueConverter.toTagged(lastEvaluatedKey));
      return Optional.of(Base64.getUrlEncoder().withoutPadding().encodeToString(json));
    } catch (JsonProcessingException e) {
      log.error("Failed to encode cursor: {}", lastEvaluatedKey, e);
      throw new EncodingException("Failed to encode cursor", e);
    }
  }

  /**
   * Decodes a token.
   *
   * @param token the token, may be null or blank
   * @return the cursor, empty for a missing token
   */
  public Map<String, AttributeValue> decode(final String token) {
    log.trace("decode({})", token);
    if (token == null || token.isBlank()) {
      return Map.of();
    }
    try {
      final byte[] json = Base64.getUrlDecoder().decode(token);
      return attributeValueConverter.fromTagged(objectMapper.readTree(new String(json, StandardCharsets.UTF_8)));
    } catch (IllegalArgumentException | JsonProcessingException e) {
      log.warn("Invalid cursor token: {}", token);
      throw new DecodingException("Invalid cursor token", e);
    }
  }
}
