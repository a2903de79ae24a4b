package com.codeheadsystems.entitystore.dagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Entity store module.
 */
@Module
public class EntityStoreModule {

  /**
   * Instantiates a new Entity store module.
   */
  public EntityStoreModule() {
    // Default constructor
  }

  /**
   * Object mapper used to map entities. Unknown attributes on stored items are ignored.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

}
