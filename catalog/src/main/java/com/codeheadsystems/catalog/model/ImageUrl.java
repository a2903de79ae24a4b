package com.codeheadsystems.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Image url.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableImageUrl.class)
@JsonDeserialize(builder = ImmutableImageUrl.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ImageUrl {

  /**
   * Url string.
   *
   * @return the string
   */
  @JsonProperty("url")
  String url();

  /**
   * Alternate text.
   *
   * @return the string
   */
  @JsonProperty("alt")
  @Value.Default
  default String alt() {
    return "";
  }

}
