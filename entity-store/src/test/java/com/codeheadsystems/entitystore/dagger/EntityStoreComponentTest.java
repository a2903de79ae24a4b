package com.codeheadsystems.entitystore.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.entitystore.model.ImmutableEntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.Widget;
import com.codeheadsystems.entitystore.repository.Repository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@ExtendWith(MockitoExtension.class)
class EntityStoreComponentTest {

  @Mock private DynamoDbClient dynamoDbClient;

  @Test
  void instance_sharesSingletons() {
    final EntityStoreComponent component = EntityStoreComponent.instance(
        ImmutableEntityStoreConfiguration.builder().build(), dynamoDbClient);

    assertThat(component.repositoryFactory()).isSameAs(component.repositoryFactory());
    assertThat(component.tableManager()).isSameAs(component.tableManager());
    assertThat(component.cursorCodec()).isNotNull();
    assertThat(component.repositoryFactory().keyBuilder()).isNotNull();
  }

  @Test
  void repositoryFactory_buildsRepositoryForTable() {
    final EntityStoreComponent component = DaggerEntityStoreComponent.builder()
        .configurationModule(new ConfigurationModule(dynamoDbClient))
        .build();

    final Repository<Widget> repository = component.repositoryFactory().create(Widget.class, "Widgets");

    assertThat(repository.tableName()).isEqualTo("Widgets");
  }
}
