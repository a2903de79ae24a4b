package com.codeheadsystems.entitystore.manager;

import com.codeheadsystems.entitystore.converter.EntityCodec;
import com.codeheadsystems.entitystore.exception.EncodingException;
import com.codeheadsystems.entitystore.exception.OperationCancelledException;
import com.codeheadsystems.entitystore.exception.PartialBatchFailureException;
import com.codeheadsystems.entitystore.model.EntityStoreConfiguration;
import com.codeheadsystems.entitystore.util.Sleeper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.InternalServerErrorException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Writes any number of entities with batch puts. Items go out in chunks of at most the
 * configured batch size; the unprocessed part of a chunk is resent after a quadratic backoff
 * until the attempts run out. Chunks are independent: one exhausted chunk does not stop the
 * next.
 *
 * @param <T> the entity type
 */
public class BatchWriter<T> {

  private static final Logger log = LoggerFactory.getLogger(BatchWriter.class);

  private final DynamoDbClient dynamoDbClient;
  private final EntityCodec<T> entityCodec;
  private final EntityStoreConfiguration configuration;
  private final Sleeper sleeper;
  private final String tableName;

  /**
   * Instantiates a new Batch writer.
   *
   * @param dynamoDbClient the dynamo db client
   * @param entityCodec    the entity codec
   * @param configuration  the configuration
   * @param sleeper        the sleeper
   * @param tableName      the table name
   */
  public BatchWriter(final DynamoDbClient dynamoDbClient,
                     final EntityCodec<T> entityCodec,
                     final EntityStoreConfiguration configuration,
                     final Sleeper sleeper,
                     final String tableName) {
    log.info("BatchWriter({}, {}, {})", entityCodec.entityClass().getSimpleName(), configuration, tableName);
    this.dynamoDbClient = dynamoDbClient;
    this.entityCodec = entityCodec;
    this.configuration = configuration;
    this.sleeper = sleeper;
    this.tableName = tableName;
  }

  /**
   * Write all entities.
   *
   * @param entities the entities
   * @return how many were written
   * @throws PartialBatchFailureException when some could not be encoded or stayed unprocessed
   */
  public int writeAll(final List<T> entities) {
    log.trace("writeAll({})", entities.size());
    final List<EncodingException> encodingFailures = new ArrayList<>();
    final List<WriteRequest> requests = new ArrayList<>();
    for (T entity : entities) {
      try {
        requests.add(WriteRequest.builder()
            .putRequest(PutRequest.builder().item(entityCodec.marshal(entity)).build())
            .build());
      } catch (EncodingException e) {
        log.warn("Skipping entity that cannot be encoded: {}", e.getMessage());
        encodingFailures.add(e);
      }
    }
    int written = 0;
    int remaining = 0;
    for (int start = 0; start < requests.size(); start += configuration.maxBatchSize()) {
      final List<WriteRequest> chunk = requests.subList(start, Math.min(requests.size(), start + configuration.maxBatchSize()));
      final int left = writeChunk(chunk);
      written += chunk.size() - left;
      remaining += left;
    }
    if (remaining > 0 || !encodingFailures.isEmpty()) {
      log.error("Batch write to {} incomplete: written={}, remaining={}, encodingFailures={}",
          tableName, written, remaining, encodingFailures.size());
      throw new PartialBatchFailureException(written, remaining, encodingFailures);
    }
    return written;
  }

  /**
   * Writes one chunk.
   *
   * @return how many requests stayed unprocessed
   */
  private int writeChunk(final List<WriteRequest> chunk) {
    List<WriteRequest> pending = chunk;
    for (int attempt = 1; attempt <= configuration.maxBatchAttempts() && !pending.isEmpty(); attempt++) {
      if (attempt > 1) {
        backoff(attempt);
      }
      try {
        final BatchWriteItemResponse response = dynamoDbClient.batchWriteItem(BatchWriteItemRequest.builder()
            .requestItems(Map.of(tableName, pending))
            .build());
        pending = response.hasUnprocessedItems()
            ? response.unprocessedItems().getOrDefault(tableName, List.of())
            : List.of();
        if (!pending.isEmpty()) {
          log.debug("Attempt {} left {} items unprocessed on {}", attempt, pending.size(), tableName);
        }
      } catch (DynamoDbException e) {
        if (!isTransient(e)) {
          throw e;
        }
        log.warn("Attempt {} of batch write to {} throttled: {}", attempt, tableName, e.getMessage());
      }
    }
    return pending.size();
  }

  private void backoff(final int attempt) {
    final long delay = (long) (attempt - 1) * (attempt - 1) * configuration.batchBackoffBaseMillis();
    log.debug("Backing off {}ms before attempt {} on {}", delay, attempt, tableName);
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("Batch write to " + tableName + " interrupted", e);
    }
  }

  private boolean isTransient(final DynamoDbException e) {
    return e instanceof ProvisionedThroughputExceededException
        || e instanceof RequestLimitExceededException
        || e instanceof InternalServerErrorException
        || e.isThrottlingException();
  }
}
