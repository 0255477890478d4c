package com.myorg.scf.sidecar.sync;

import com.myorg.scf.contracts.core.exception.StoreNotConfiguredException;
import com.myorg.scf.settings.SyncableFieldRegistry;
import com.myorg.scf.sidecar.client.ConfigSyncResult;
import com.myorg.scf.sidecar.client.RemoteCoordinationClient;
import com.myorg.scf.sidecar.client.SyncOutcome;
import com.myorg.scf.sidecar.config.ServiceSecrets;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.config.SyncProperties;
import com.myorg.scf.sidecar.observability.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * One pass of config or secret sync: which keys to ask for, the remote read, and writing the answers back.
 * Used by the periodic scheduler and by the manual sync routes.
 */
@Slf4j
@RequiredArgsConstructor
public class SettingsSynchronizer implements AutoCloseable {

    private final RemoteCoordinationClient client;
    private final ServiceSettings settings;
    private final ServiceSecrets secrets;
    private final SyncableFieldRegistry<ServiceSettings> configFields;
    private final SyncableFieldRegistry<ServiceSecrets> secretFields;
    private final SyncProperties props;
    private final SyncMetrics metrics; // may be null

    public SyncOutcome syncConfigurations() {
        if (isBlank(settings.getConfigstoreName())) throw new StoreNotConfiguredException("Config store");

        List<String> keys = configFields.fieldsToSync(settings);
        boolean subscribe = props.isSubscribeConfigChanges() && settings.getConfigSubscriptionId() == null;

        ConfigSyncResult result = client.syncConfig(keys, subscribe);
        if (result.subscriptionId() != null) {
            settings.setConfigSubscriptionId(result.subscriptionId());
        }

        int applied = configFields.applyValues(settings, result.values());
        if (metrics != null) metrics.addConfigSynced(applied);
        log.debug("Config sync applied={} received={} requested={}", applied, result.values().size(), keys.size());
        return new SyncOutcome(result.values().size(), keys.size());
    }

    public SyncOutcome syncSecrets() {
        if (isBlank(settings.getSecretstoreName())) throw new StoreNotConfiguredException("Secret store");

        List<String> keys = secretFields.fieldsToSync(secrets);
        Map<String, String> values = client.syncSecrets(keys);

        int applied = secretFields.applyValues(secrets, values);
        if (metrics != null) metrics.addSecretsSynced(applied);
        return new SyncOutcome(values.size(), keys.size());
    }

    /** Values pushed by the config store for an active subscription. */
    public int applyConfigurationUpdate(Map<String, String> values) {
        int applied = configFields.applyValues(settings, values);
        if (metrics != null) metrics.addConfigSynced(applied);
        log.info("Applied {} pushed configuration value(s)", applied);
        return applied;
    }

    /** Releases the config subscription, if any. */
    @Override
    public void close() {
        String id = settings.getConfigSubscriptionId();
        if (id == null) return;
        if (client.unsubscribeConfig(id)) {
            log.info("Released config subscription id={}", id);
        }
        settings.setConfigSubscriptionId(null);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
