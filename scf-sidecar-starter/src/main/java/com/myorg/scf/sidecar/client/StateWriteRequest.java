package com.myorg.scf.sidecar.client;

import com.myorg.scf.contracts.state.StateConcurrency;
import com.myorg.scf.contracts.state.StateConsistency;
import lombok.Builder;
import lombok.Value;

/**
 * One write to the durable state store.
 *
 * <p>A {@code String} value is stored as is; anything else is stored as JSON and tagged
 * {@code contentType=application/json}. With no {@code etag} the current one is read first,
 * unless {@code skipEtagIfUnset} is set.
 */
@Value
@Builder
public class StateWriteRequest {
    // null -> discovered state store
    String storeName;
    String key;
    Object value;
    String etag;
    @Builder.Default
    StateConcurrency concurrency = StateConcurrency.UNSPECIFIED;
    @Builder.Default
    StateConsistency consistency = StateConsistency.UNSPECIFIED;
    Integer ttlSeconds;
    boolean skipEtagIfUnset;
}
