package com.myorg.scf.sidecar.client;

import java.util.Map;

/**
 * Values read from the configuration store, keyed by remote key. Keys the store did not return are absent.
 *
 * @param subscriptionId id of the change subscription, {@code null} when none was requested or it failed
 */
public record ConfigSyncResult(Map<String, String> values, String subscriptionId) {

    public ConfigSyncResult {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static ConfigSyncResult empty() {
        return new ConfigSyncResult(Map.of(), null);
    }
}
