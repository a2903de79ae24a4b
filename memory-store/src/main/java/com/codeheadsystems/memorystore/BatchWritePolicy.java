package com.codeheadsystems.memorystore;

import java.util.List;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Decides which requests of a batch write call are left unprocessed. Lets tests reproduce
 * throttled batch writes.
 */
@FunctionalInterface
public interface BatchWritePolicy {

  /**
   * Policy that processes everything.
   */
  BatchWritePolicy PROCESS_ALL = (tableName, requests) -> List.of();

  /**
   * Select the unprocessed requests.
   *
   * @param tableName the table the requests target
   * @param requests  the requests of this call for the table
   * @return the requests that are not applied and are returned as unprocessed
   */
  List<WriteRequest> unprocessed(String tableName, List<WriteRequest> requests);
}
