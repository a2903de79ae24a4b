package com.codeheadsystems.entitystore.model;

import org.immutables.value.Value;

/**
 * A scan of the table or one of its indexes.
 */
@Value.Immutable
public interface ScanSpec extends ReadSpec {

}
