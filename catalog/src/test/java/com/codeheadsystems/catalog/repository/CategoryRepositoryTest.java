package com.codeheadsystems.catalog.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.catalog.dagger.CatalogComponent;
import com.codeheadsystems.catalog.model.Category;
import com.codeheadsystems.entitystore.model.ImmutableEntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.ImmutableUpdateOptions;
import com.codeheadsystems.memorystore.InMemoryDynamoDbClient;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CategoryRepositoryTest {

  private CategoryRepository categoryRepository;

  @BeforeEach
  void setup() {
    final CatalogComponent component = CatalogComponent.instance(
        ImmutableEntityStoreConfiguration.builder().build(), new InMemoryDynamoDbClient());
    component.catalogTables().ensureAll();
    categoryRepository = component.categoryRepository();
    categoryRepository.saveBatch(List.of(new Category("c-1", "Tools"), new Category("c-2", "Garden")));
  }

  @Test
  void findByName() {
    assertThat(categoryRepository.findByName("Garden")).extracting(Category::getId).containsExactly("c-2");
    assertThat(categoryRepository.findByName("Kitchen")).isEmpty();
  }

  @Test
  void updateById_renameIsFoundByNewName() {
    final Category renamed = categoryRepository.updateById("c-1", ImmutableUpdateOptions.builder()
        .putAssignments("name", "Power Tools")
        .returnUpdated(true)
        .build()).orElseThrow();

    assertThat(renamed.getName()).isEqualTo("Power Tools");
    assertThat(renamed.getUpdatedAt()).isGreaterThanOrEqualTo(renamed.getCreatedAt());
    assertThat(categoryRepository.findByName("Power Tools")).hasSize(1);
    assertThat(categoryRepository.findByName("Tools")).isEmpty();
  }

  @Test
  void deleteById_removes() {
    categoryRepository.deleteById("c-2");

    assertThat(categoryRepository.exists("c-2")).isFalse();
    assertThat(categoryRepository.scanAll()).extracting(Category::getId).containsExactly("c-1");
  }
}
