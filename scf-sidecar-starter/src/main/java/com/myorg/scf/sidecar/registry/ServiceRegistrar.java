package com.myorg.scf.sidecar.registry;

import com.myorg.scf.contracts.core.exception.RegistrationException;
import com.myorg.scf.contracts.registry.ServiceMetadataRecord;
import com.myorg.scf.sidecar.client.RemoteCoordinationClient;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.observability.SyncMetrics;
import com.myorg.scf.sidecar.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;

/**
 * Discovers what the sidecar offers, records it on {@link ServiceSettings}, and optionally registers
 * this service's record in the shared state store.
 */
@Slf4j
@RequiredArgsConstructor
public class ServiceRegistrar {

    private final RemoteCoordinationClient client;
    private final ServiceSettings settings;
    private final RetryPolicy discoveryRetry;
    private final SyncMetrics metrics; // may be null

    /**
     * @param register also persist the record; requires a discovered state store
     * @throws com.myorg.scf.contracts.core.exception.DiscoveryException listing unusable, nothing written
     * @throws com.myorg.scf.contracts.core.exception.StoreUnavailableException sidecar unreachable after all discovery attempts
     * @throws RegistrationException no state store, or every registration attempt failed
     */
    public ServiceMetadataRecord bootstrap(boolean register) {
        return bootstrap(register, () -> false);
    }

    /**
     * Same as {@link #bootstrap(boolean)}, but gives up between attempts once {@code cancelled} is true,
     * and never writes the record after that.
     */
    public ServiceMetadataRecord bootstrap(boolean register, BooleanSupplier cancelled) {
        ServiceMetadataRecord record = discoveryRetry.execute(client::discoverCapabilities, cancelled);

        if (settings.getName() != null && !settings.getName().equals(record.getServiceId())) {
            log.warn("Sidecar app id={} differs from scf.service.name={}", record.getServiceId(), settings.getName());
        }
        settings.applyDiscovered(record);
        log.info("Discovered components for serviceId={}: configstore={} secretstore={} statestore={} pubsub={} topic={} crypto={}",
                record.getServiceId(), record.getConfigStoreName(), record.getSecretStoreName(),
                record.getStateStoreName(), record.getPubsubName(), record.getInboundTopic(),
                record.getCryptoComponentName());

        if (!register) return record;
        if (cancelled.getAsBoolean()) {
            log.info("Shutdown requested, registration of serviceId={} skipped", record.getServiceId());
            return record;
        }

        if (record.getStateStoreName() == null || record.getStateStoreName().isBlank()) {
            if (metrics != null) metrics.incRegistrationFailed();
            throw new RegistrationException("statestore is not configured.");
        }
        try {
            client.registerService(record);
        } catch (RuntimeException e) {
            if (metrics != null) metrics.incRegistrationFailed();
            throw e;
        }
        if (metrics != null) metrics.incRegistered();
        return record;
    }
}
