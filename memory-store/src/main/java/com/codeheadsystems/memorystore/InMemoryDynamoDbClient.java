package com.codeheadsystems.memorystore;

import com.codeheadsystems.memorystore.expression.ConditionExpressionEvaluator;
import com.codeheadsystems.memorystore.expression.UpdateExpressionEvaluator;
import com.codeheadsystems.memorystore.manager.MemoryItemManager;
import com.codeheadsystems.memorystore.manager.MemoryTableManager;
import com.codeheadsystems.memorystore.model.MemoryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.CreateTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ListTablesResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * A DynamoDbClient that keeps its tables in memory. Covers the table and item calls used by the
 * entity store, including condition, filter, key condition and projection expressions,
 * pagination and Select.COUNT.
 */
public class InMemoryDynamoDbClient implements DynamoDbClient {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDynamoDbClient.class);

  private static final String SERVICE_NAME = "dynamodb";

  private final MemoryTableManager tableManager;
  private final MemoryItemManager itemManager;

  /**
   * Instantiates a new client whose tables are ACTIVE immediately.
   */
  public InMemoryDynamoDbClient() {
    this(0);
  }

  /**
   * Instantiates a new client.
   *
   * @param creatingDescribes how many describe calls of a new table report CREATING before ACTIVE
   */
  public InMemoryDynamoDbClient(final int creatingDescribes) {
    log.info("InMemoryDynamoDbClient({})", creatingDescribes);
    final ConditionExpressionEvaluator conditionExpressionEvaluator = new ConditionExpressionEvaluator();
    this.tableManager = new MemoryTableManager(creatingDescribes);
    this.itemManager = new MemoryItemManager(tableManager, conditionExpressionEvaluator,
        new UpdateExpressionEvaluator(conditionExpressionEvaluator));
  }

  /**
   * Replace the policy deciding which batch write requests stay unprocessed.
   *
   * @param batchWritePolicy the policy
   */
  public void setBatchWritePolicy(final BatchWritePolicy batchWritePolicy) {
    itemManager.setBatchWritePolicy(batchWritePolicy);
  }

  @Override
  public String serviceName() {
    return SERVICE_NAME;
  }

  @Override
  public void close() {

  }

  @Override
  public ListTablesResponse listTables(final ListTablesRequest listTablesRequest) throws AwsServiceException, SdkClientException {
    return ListTablesResponse.builder().tableNames(tableManager.listTables()).build();
  }

  @Override
  public CreateTableResponse createTable(final CreateTableRequest createTableRequest) throws AwsServiceException, SdkClientException {
    final MemoryTable table = tableManager.insertTable(createTableRequest)
        .orElseThrow(() -> ResourceInUseException.builder()
            .message("Table already exists: " + createTableRequest.tableName())
            .build());
    return CreateTableResponse.builder().tableDescription(table.describeAs(TableStatus.CREATING)).build();
  }

  @Override
  public DescribeTableResponse describeTable(final DescribeTableRequest describeTableRequest) throws AwsServiceException, SdkClientException {
    return DescribeTableResponse.builder()
        .table(tableManager.requireTable(describeTableRequest.tableName()).describe())
        .build();
  }

  @Override
  public DeleteTableResponse deleteTable(final DeleteTableRequest deleteTableRequest) throws AwsServiceException, SdkClientException {
    final MemoryTable table = tableManager.deleteTable(deleteTableRequest.tableName())
        .orElseThrow(() -> ResourceNotFoundException.builder()
            .message("Requested resource not found: Table: " + deleteTableRequest.tableName() + " not found")
            .build());
    return DeleteTableResponse.builder().tableDescription(table.describeAs(TableStatus.DELETING)).build();
  }

  @Override
  public PutItemResponse putItem(final PutItemRequest putItemRequest) throws AwsServiceException, SdkClientException {
    return itemManager.putItem(putItemRequest);
  }

  @Override
  public GetItemResponse getItem(final GetItemRequest getItemRequest) throws AwsServiceException, SdkClientException {
    return itemManager.getItem(getItemRequest);
  }

  @Override
  public UpdateItemResponse updateItem(final UpdateItemRequest updateItemRequest) throws AwsServiceException, SdkClientException {
    return itemManager.updateItem(updateItemRequest);
  }

  @Override
  public DeleteItemResponse deleteItem(final DeleteItemRequest deleteItemRequest) throws AwsServiceException, SdkClientException {
    return itemManager.deleteItem(deleteItemRequest);
  }

  @Override
  public BatchWriteItemResponse batchWriteItem(final BatchWriteItemRequest batchWriteItemRequest) throws AwsServiceException, SdkClientException {
    return itemManager.batchWriteItem(batchWriteItemRequest);
  }

  @Override
  public QueryResponse query(final QueryRequest queryRequest) throws AwsServiceException, SdkClientException {
    return itemManager.query(queryRequest);
  }

  @Override
  public ScanResponse scan(final ScanRequest scanRequest) throws AwsServiceException, SdkClientException {
    return itemManager.scan(scanRequest);
  }
}
