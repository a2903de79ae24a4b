package com.codeheadsystems.catalog.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.catalog.dagger.CatalogComponent;
import com.codeheadsystems.catalog.model.Brand;
import com.codeheadsystems.entitystore.exception.ConditionFailedException;
import com.codeheadsystems.entitystore.model.ImmutableEntityStoreConfiguration;
import com.codeheadsystems.memorystore.InMemoryDynamoDbClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BrandRepositoryTest {

  private BrandRepository brandRepository;

  @BeforeEach
  void setup() {
    final CatalogComponent component = CatalogComponent.instance(
        ImmutableEntityStoreConfiguration.builder().build(), new InMemoryDynamoDbClient());
    component.catalogTables().ensureAll();
    brandRepository = component.brandRepository();
  }

  @Test
  void findByName_exactMatchOnly() {
    brandRepository.save(new Brand("b-1", "Acme"));
    brandRepository.save(new Brand("b-2", "Acme Tools"));
    brandRepository.save(new Brand("b-3", "Acme"));

    assertThat(brandRepository.findByName("Acme"))
        .extracting(Brand::getId).containsExactlyInAnyOrder("b-1", "b-3");
    assertThat(brandRepository.findByName("acme")).isEmpty();
  }

  @Test
  void saveIfNotExists_keepsFirst() {
    brandRepository.saveIfNotExists(new Brand("b-1", "Acme"));

    assertThatThrownBy(() -> brandRepository.saveIfNotExists(new Brand("b-1", "Other")))
        .isInstanceOf(ConditionFailedException.class);
    assertThat(brandRepository.findById("b-1")).map(Brand::getName).contains("Acme");
  }

  @Test
  void save_setsCapabilities() {
    final Brand brand = new Brand("b-1", "Acme");

    brandRepository.save(brand);

    assertThat(brandRepository.findById("b-1")).contains(brand);
    assertThat(brand.getVersion()).isEqualTo(1L);
    assertThat(brand.getCreatedAt()).isNotNull();
  }
}
