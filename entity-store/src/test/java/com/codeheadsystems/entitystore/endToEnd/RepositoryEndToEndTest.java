package com.codeheadsystems.entitystore.endToEnd;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.entitystore.converter.CursorCodec;
import com.codeheadsystems.entitystore.dagger.EntityStoreComponent;
import com.codeheadsystems.entitystore.exception.ConditionFailedException;
import com.codeheadsystems.entitystore.exception.PartialBatchFailureException;
import com.codeheadsystems.entitystore.expression.ExpressionBuilder;
import com.codeheadsystems.entitystore.model.ImmutableEntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.ImmutableQuerySpec;
import com.codeheadsystems.entitystore.model.ImmutableTableDefinition;
import com.codeheadsystems.entitystore.model.ImmutableUpdateOptions;
import com.codeheadsystems.entitystore.model.Note;
import com.codeheadsystems.entitystore.model.PageResult;
import com.codeheadsystems.entitystore.model.QuerySpec;
import com.codeheadsystems.entitystore.model.TableDefinition;
import com.codeheadsystems.entitystore.model.Widget;
import com.codeheadsystems.entitystore.repository.Repository;
import com.codeheadsystems.memorystore.InMemoryDynamoDbClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Runs the repositories against the in-memory store.
 */
class RepositoryEndToEndTest {

  private static final String WIDGETS = "Widgets";
  private static final String CATEGORY_INDEX = "categoryId-index";

  private InMemoryDynamoDbClient dynamoDbClient;
  private EntityStoreComponent component;
  private Repository<Widget> repository;

  @BeforeEach
  void setup() {
    dynamoDbClient = new InMemoryDynamoDbClient(2);
    component = EntityStoreComponent.instance(ImmutableEntityStoreConfiguration.builder()
        .tablePollIntervalMillis(1)
        .batchBackoffBaseMillis(1)
        .build(), dynamoDbClient);
    component.tableManager().ensureTable(ImmutableTableDefinition.builder()
        .from(TableDefinition.simple(WIDGETS))
        .addAttributeDefinitions(AttributeDefinition.builder()
            .attributeName("categoryId").attributeType(ScalarAttributeType.S).build())
        .addGlobalSecondaryIndexes(GlobalSecondaryIndex.builder()
            .indexName(CATEGORY_INDEX)
            .keySchema(KeySchemaElement.builder().attributeName("categoryId").keyType(KeyType.HASH).build())
            .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
            .build())
        .build());
    repository = component.repositoryFactory().create(Widget.class, WIDGETS);
  }

  @Test
  void ensureTable_waitedForActive() {
    assertThat(component.tableManager().tableExists(WIDGETS)).isTrue();
    assertThat(repository.tableName()).isEqualTo(WIDGETS);
  }

  @Test
  void save_thenFind_roundTripsWithCapabilities() {
    final Widget widget = widget("w-1", "tools");
    widget.setTags(List.of("a", "b"));
    widget.setAttributes(Map.of("size", 3, "weight", 2.75));

    repository.save(widget);
    final Optional<Widget> found = repository.findById("w-1");

    assertThat(found).contains(widget);
    assertThat(found.get().getCreatedAt()).isNotNull().isEqualTo(found.get().getUpdatedAt());
    assertThat(found.get().getVersion()).isEqualTo(1L);
    assertThat(repository.findByIdConsistent("w-1")).contains(widget);
    assertThat(repository.exists("w-1")).isTrue();
  }

  @Test
  void findById_missing_isEmpty() {
    assertThat(repository.findById("nope")).isEmpty();
    assertThat(repository.exists("nope")).isFalse();
  }

  @Test
  void entityWithoutCapabilities_storesOnlyItsFields() {
    final Repository<Note> notes = component.repositoryFactory().create(Note.class, "Notes");
    component.tableManager().ensureTable(TableDefinition.simple("Notes"));

    notes.save(new Note("n-1", "hello"));

    assertThat(notes.findById("n-1")).map(Note::getText).contains("hello");
  }

  @Test
  void saveIfNotExists_secondTime_conditionFails() {
    repository.saveIfNotExists(widget("w-1", "tools"));

    assertThatThrownBy(() -> repository.saveIfNotExists(widget("w-1", "garden")))
        .isInstanceOf(ConditionFailedException.class);
    assertThat(repository.findById("w-1")).map(Widget::getCategoryId).contains("tools");
  }

  @Test
  void save_overwrites() {
    repository.save(widget("w-1", "tools"));
    repository.save(widget("w-1", "garden"));

    assertThat(repository.findById("w-1")).map(Widget::getCategoryId).contains("garden");
    assertThat(repository.scanAll()).hasSize(1);
  }

  @Test
  void delete_isIdempotent() {
    final Widget widget = widget("w-1", "tools");
    repository.save(widget);

    repository.delete(widget);
    repository.deleteById("w-1");

    assertThat(repository.findById("w-1")).isEmpty();
  }

  @Test
  void updateWithOptimisticLock_staleVersionRejected() {
    final Widget widget = widget("w-1", "tools");
    repository.save(widget);

    final Widget updated = repository.updateWithOptimisticLock(widget, Map.of("name", "Renamed"));

    assertThat(updated.getName()).isEqualTo("Renamed");
    assertThat(updated.getVersion()).isEqualTo(2L);
    assertThat(updated.getCreatedAt()).isEqualTo(widget.getCreatedAt());
    assertThatThrownBy(() -> repository.updateWithOptimisticLock(widget, Map.of("name", "Stale")))
        .isInstanceOf(ConditionFailedException.class);
    assertThat(repository.updateWithOptimisticLock(updated, Map.of("stock", 7L)).getVersion()).isEqualTo(3L);
    assertThat(repository.findById("w-1")).map(Widget::getName).contains("Renamed");
  }

  @Test
  void updateWithOptimisticLock_unversioned_rejected() {
    final Repository<Note> notes = component.repositoryFactory().create(Note.class, "Notes");

    assertThatThrownBy(() -> notes.updateWithOptimisticLock(new Note("n-1", "x"), Map.of("text", "y")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void updateById_returnsUpdatedWhenAsked() {
    repository.save(widget("w-1", "tools"));

    final Optional<Widget> quiet = repository.updateById("w-1", ImmutableUpdateOptions.builder()
        .putAssignments("stock", 12L)
        .build());
    final Optional<Widget> loud = repository.updateById("w-1", ImmutableUpdateOptions.builder()
        .putAssignments("note", "checked")
        .conditionExpression("attribute_exists(#id)")
        .putExpressionAttributeNames("#id", "id")
        .returnUpdated(true)
        .build());

    assertThat(quiet).isEmpty();
    assertThat(loud).isPresent();
    assertThat(loud.get().getStock()).isEqualTo(12L);
    assertThat(loud.get().getNote()).isEqualTo("checked");
  }

  @Test
  void update_conditionOnMissingItem_fails() {
    assertThatThrownBy(() -> repository.update(widget("ghost", "tools"), ImmutableUpdateOptions.builder()
        .putAssignments("name", "x")
        .conditionExpression("attribute_exists(#id)")
        .putExpressionAttributeNames("#id", "id")
        .build()))
        .isInstanceOf(ConditionFailedException.class);
  }

  @Test
  void saveBatch_writesEverything() {
    assertThat(repository.saveBatch(widgets(60, "tools"))).isEqualTo(60);

    assertThat(repository.scanAll()).hasSize(60);
  }

  @Test
  void saveBatch_throttled_reportsRemaining() {
    dynamoDbClient.setBatchWritePolicy((table, requests) -> requests.subList(0, Math.min(2, requests.size())));

    assertThatThrownBy(() -> repository.saveBatch(widgets(10, "tools")))
        .isInstanceOf(PartialBatchFailureException.class)
        .satisfies(e -> assertThat(((PartialBatchFailureException) e).remainingCount()).isEqualTo(2));
    assertThat(repository.scanAll()).hasSize(8);
  }

  @Test
  void query_byIndex_countAndLimit() {
    repository.saveBatch(widgets(7, "tools"));
    repository.saveBatch(List.of(widget("g-1", "garden"), widget("g-2", "garden")));

    assertThat(repository.query(byCategory("tools").build())).hasSize(7)
        .allSatisfy(w -> assertThat(w.getCategoryId()).isEqualTo("tools"));
    assertThat(repository.query(byCategory("tools").limit(3).build())).hasSize(3);
    assertThat(repository.count(byCategory("garden").build())).isEqualTo(2L);
    assertThat(repository.count(byCategory("none").build())).isZero();
  }

  @Test
  void queryWithPaging_cursorTokensVisitEveryItemOnce() {
    repository.saveBatch(widgets(7, "tools"));
    final CursorCodec cursorCodec = component.cursorCodec();
    final List<String> seen = new ArrayList<>();
    Optional<String> token = Optional.empty();
    int pages = 0;
    do {
      final QuerySpec spec = byCategory("tools")
          .pageSize(3)
          .exclusiveStartKey(cursorCodec.decode(token.orElse(null)))
          .build();
      final PageResult<Widget> page = repository.queryWithPaging(spec);
      page.items().forEach(w -> seen.add(w.getId()));
      token = cursorCodec.encode(page.lastEvaluatedKey());
      pages++;
    } while (token.isPresent());

    assertThat(pages).isEqualTo(3);
    assertThat(seen).hasSize(7).doesNotHaveDuplicates();
  }

  @Test
  void scanWithPaging_filterAndProjection() {
    final List<Widget> widgets = widgets(5, "tools");
    widgets.get(2).setName("Special widget");
    repository.saveBatch(widgets);

    final List<Widget> found = repository.scan(ExpressionBuilder.builder()
        .contains("name", "Special")
        .project("id", "name")
        .buildScanSpec());
    final PageResult<Widget> firstPage = repository.scanWithPaging(ExpressionBuilder.builder()
        .toScanSpec()
        .pageSize(2)
        .build());

    assertThat(found).extracting(Widget::getId).containsExactly("w-2");
    assertThat(found.get(0).getCategoryId()).isNull();
    assertThat(firstPage.items()).hasSize(2);
    assertThat(firstPage.hasMore()).isTrue();
  }

  private ImmutableQuerySpec.Builder byCategory(final String categoryId) {
    return ImmutableQuerySpec.builder()
        .indexName(CATEGORY_INDEX)
        .keyConditionExpression("#c = :c")
        .putExpressionAttributeNames("#c", "categoryId")
        .putExpressionAttributeValues(":c", AttributeValue.builder().s(categoryId).build());
  }

  private Widget widget(final String id, final String categoryId) {
    final Widget widget = new Widget(id, "Widget " + id, 4.5);
    widget.setCategoryId(categoryId);
    return widget;
  }

  private List<Widget> widgets(final int count, final String categoryId) {
    return IntStream.range(0, count)
        .mapToObj(i -> widget("w-" + i, categoryId))
        .collect(Collectors.toList());
  }
}
