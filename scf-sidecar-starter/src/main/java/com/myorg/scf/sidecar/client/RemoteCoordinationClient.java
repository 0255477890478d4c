package com.myorg.scf.sidecar.client;

import com.myorg.scf.contracts.registry.ServiceMetadataRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations against the sidecar. Store and bus names default to those discovered at bootstrap;
 * an operation that needs one that was never discovered fails with
 * {@link com.myorg.scf.contracts.core.exception.StoreNotConfiguredException}.
 */
public interface RemoteCoordinationClient {

    /**
     * Single discovery call, no retry.
     *
     * @throws com.myorg.scf.contracts.core.exception.StoreUnavailableException sidecar unreachable
     * @throws com.myorg.scf.contracts.core.exception.DiscoveryException sidecar answered with an error or an unusable listing
     */
    ServiceMetadataRecord discoverCapabilities();

    /** Reads the keys from the configuration store. Read and subscription failures are logged, never thrown. */
    ConfigSyncResult syncConfig(List<String> keys, boolean subscribe);

    boolean unsubscribeConfig(String subscriptionId);

    /** Reads each key on its own; a key that fails is logged and left out. */
    Map<String, String> syncSecrets(List<String> keys);

    /**
     * @throws com.myorg.scf.contracts.core.exception.ConflictException stale etag under first-write
     * @throws com.myorg.scf.contracts.core.exception.StoreUnavailableException transport failure or 5xx
     */
    void writeState(StateWriteRequest request);

    /** Raw stored value, empty when the key does not exist. */
    Optional<String> readState(String storeName, String key);

    /** Registration record of a peer, empty when absent or unreadable. */
    Optional<ServiceMetadataRecord> getServiceMetadata(String serviceId);

    /**
     * Writes the record under its well-known key (first-write, strong), retried at a fixed interval.
     *
     * @throws com.myorg.scf.contracts.core.exception.RegistrationException all attempts failed
     */
    void registerService(ServiceMetadataRecord record);

    /**
     * @return id of the published event
     * @throws com.myorg.scf.contracts.core.exception.UnresolvedTopicException the target service has no topic
     */
    String publish(PublishRequest request);
}
