package com.codeheadsystems.entitystore.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.entitystore.exception.OperationCancelledException;
import com.codeheadsystems.entitystore.exception.TableUnavailableException;
import com.codeheadsystems.entitystore.model.ImmutableEntityStoreConfiguration;
import com.codeheadsystems.entitystore.model.ImmutableTableDefinition;
import com.codeheadsystems.entitystore.model.TableDefinition;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

@ExtendWith(MockitoExtension.class)
class TableManagerTest {

  private static final String TABLE = "Widgets";
  private static final DescribeTableResponse ACTIVE = status(TableStatus.ACTIVE);
  private static final DescribeTableResponse CREATING = status(TableStatus.CREATING);

  @Mock private DynamoDbClient dynamoDbClient;
  @Captor private ArgumentCaptor<CreateTableRequest> createCaptor;

  private final List<Long> sleeps = new ArrayList<>();
  private SteppingClock clock;
  private TableManager tableManager;

  private static DescribeTableResponse status(final TableStatus status) {
    return DescribeTableResponse.builder()
        .table(TableDescription.builder().tableName(TABLE).tableStatus(status).build())
        .build();
  }

  @BeforeEach
  void setup() {
    clock = new SteppingClock(Instant.ofEpochSecond(1_700_000_000L));
    tableManager = new TableManager(dynamoDbClient,
        ImmutableEntityStoreConfiguration.builder().tableActiveTimeoutSeconds(5).build(),
        millis -> {
          sleeps.add(millis);
          clock.advance(millis);
        },
        clock);
  }

  @Test
  void ensureTable_alreadyActive_doesNotCreate() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(ACTIVE);

    tableManager.ensureTable(TableDefinition.simple(TABLE));

    verify(dynamoDbClient, never()).createTable(any(CreateTableRequest.class));
    assertThat(sleeps).isEmpty();
  }

  @Test
  void ensureTable_missing_createsAndWaits() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("missing").build())
        .thenReturn(CREATING)
        .thenReturn(ACTIVE);

    tableManager.ensureTable(TableDefinition.simple(TABLE));

    verify(dynamoDbClient).createTable(createCaptor.capture());
    final CreateTableRequest request = createCaptor.getValue();
    assertThat(request.tableName()).isEqualTo(TABLE);
    assertThat(request.billingMode()).isEqualTo(BillingMode.PAY_PER_REQUEST);
    assertThat(request.keySchema()).extracting(KeySchemaElement::attributeName).containsExactly("id");
    assertThat(request.hasGlobalSecondaryIndexes()).isFalse();
    assertThat(request.hasLocalSecondaryIndexes()).isFalse();
    assertThat(request.provisionedThroughput()).isNull();
    assertThat(sleeps).containsExactly(2000L);
  }

  @Test
  void ensureTable_stillCreating_waits() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
        .thenReturn(CREATING)
        .thenReturn(CREATING)
        .thenReturn(ACTIVE);

    tableManager.ensureTable(TableDefinition.simple(TABLE));

    verify(dynamoDbClient, never()).createTable(any(CreateTableRequest.class));
    assertThat(sleeps).containsExactly(2000L);
  }

  @Test
  void ensureTable_describeFails_unavailable() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
        .thenThrow(DynamoDbException.builder().statusCode(500).message("boom").build());

    assertThatThrownBy(() -> tableManager.ensureTable(TableDefinition.simple(TABLE)))
        .isInstanceOf(TableUnavailableException.class)
        .hasCauseInstanceOf(DynamoDbException.class);
  }

  @Test
  void createTable_alreadyInUse_countsAsSuccess() {
    when(dynamoDbClient.createTable(any(CreateTableRequest.class)))
        .thenThrow(ResourceInUseException.builder().message("exists").build());
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(ACTIVE);

    tableManager.createTable(TableDefinition.simple(TABLE));

    verify(dynamoDbClient).describeTable(any(DescribeTableRequest.class));
  }

  @Test
  void createTable_createFails_unavailable() {
    when(dynamoDbClient.createTable(any(CreateTableRequest.class)))
        .thenThrow(DynamoDbException.builder().statusCode(400).message("bad schema").build());

    assertThatThrownBy(() -> tableManager.createTable(TableDefinition.simple(TABLE)))
        .isInstanceOf(TableUnavailableException.class);
  }

  @Test
  void createTable_neverActive_timesOut() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(CREATING);

    assertThatThrownBy(() -> tableManager.createTable(TableDefinition.simple(TABLE)))
        .isInstanceOf(TableUnavailableException.class)
        .hasMessageContaining("did not become active");
    assertThat(sleeps).containsExactly(2000L, 2000L, 2000L);
  }

  @Test
  void createTable_interrupted_cancels() {
    final TableManager interrupted = new TableManager(dynamoDbClient,
        ImmutableEntityStoreConfiguration.builder().build(),
        millis -> {
          throw new InterruptedException("stop");
        },
        clock);
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(CREATING);

    assertThatThrownBy(() -> interrupted.createTable(TableDefinition.simple(TABLE)))
        .isInstanceOf(OperationCancelledException.class);
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  void createTable_sendsIndexesAndThroughput() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(ACTIVE);
    final ProvisionedThroughput throughput = ProvisionedThroughput.builder()
        .readCapacityUnits(5L).writeCapacityUnits(5L).build();
    final TableDefinition definition = ImmutableTableDefinition.builder()
        .from(TableDefinition.simple(TABLE))
        .addAttributeDefinitions(AttributeDefinition.builder()
            .attributeName("categoryId").attributeType(ScalarAttributeType.S).build())
        .addGlobalSecondaryIndexes(GlobalSecondaryIndex.builder()
            .indexName("categoryId-index")
            .keySchema(KeySchemaElement.builder().attributeName("categoryId").keyType(KeyType.HASH).build())
            .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
            .provisionedThroughput(throughput)
            .build())
        .billingMode(BillingMode.PROVISIONED)
        .provisionedThroughput(throughput)
        .build();

    tableManager.createTable(definition);

    verify(dynamoDbClient).createTable(createCaptor.capture());
    assertThat(createCaptor.getValue().globalSecondaryIndexes())
        .extracting(GlobalSecondaryIndex::indexName).containsExactly("categoryId-index");
    assertThat(createCaptor.getValue().provisionedThroughput()).isEqualTo(throughput);
    assertThat(createCaptor.getValue().attributeDefinitions()).hasSize(2);
  }

  @Test
  void createTable_payPerRequest_omitsThroughput() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class))).thenReturn(ACTIVE);
    final TableDefinition definition = ImmutableTableDefinition.builder()
        .from(TableDefinition.simple(TABLE))
        .provisionedThroughput(ProvisionedThroughput.builder().readCapacityUnits(5L).writeCapacityUnits(5L).build())
        .build();

    tableManager.createTable(definition);

    verify(dynamoDbClient).createTable(createCaptor.capture());
    assertThat(createCaptor.getValue().billingMode()).isEqualTo(BillingMode.PAY_PER_REQUEST);
    assertThat(createCaptor.getValue().provisionedThroughput()).isNull();
  }

  @Test
  void provisionedDefinition_requiresThroughput() {
    assertThatThrownBy(() -> ImmutableTableDefinition.builder()
        .from(TableDefinition.simple(TABLE))
        .billingMode(BillingMode.PROVISIONED)
        .build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void tableExists() {
    when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
        .thenReturn(ACTIVE)
        .thenThrow(ResourceNotFoundException.builder().message("missing").build());

    assertThat(tableManager.tableExists(TABLE)).isTrue();
    assertThat(tableManager.tableExists(TABLE)).isFalse();
  }

  @Test
  void deleteTable_missing_isFalse() {
    when(dynamoDbClient.deleteTable(any(DeleteTableRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("missing").build());

    assertThat(tableManager.deleteTable(TABLE)).isFalse();
  }

  /**
   * Clock that only moves when the sleeper says so.
   */
  private static class SteppingClock extends Clock {

    private Instant now;

    SteppingClock(final Instant start) {
      this.now = start;
    }

    void advance(final long millis) {
      now = now.plusMillis(millis);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
