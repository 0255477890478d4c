package com.myorg.scf.sidecar.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class SyncMetrics {

    public static final String CONFIG_SYNCED = "scf.sync.config.synced";
    public static final String SECRETS_SYNCED = "scf.sync.secrets.synced";
    public static final String STEP_FAILED = "scf.sync.step.failed";
    public static final String REGISTRATION_SUCCESS = "scf.registration.success";
    public static final String REGISTRATION_FAILURE = "scf.registration.failure";

    private final MeterRegistry registry;
    private final String serviceName;

    private Counter cConfigSynced;
    private Counter cSecretsSynced;
    private Counter cRegistered;
    private Counter cRegistrationFailed;

    /** Call once on startup so the meters exist before the first round. */
    public void preRegister() {
        cConfigSynced       = Counter.builder(CONFIG_SYNCED).tag("service", serviceName).register(registry);
        cSecretsSynced      = Counter.builder(SECRETS_SYNCED).tag("service", serviceName).register(registry);
        cRegistered         = Counter.builder(REGISTRATION_SUCCESS).tag("service", serviceName).register(registry);
        cRegistrationFailed = Counter.builder(REGISTRATION_FAILURE).tag("service", serviceName).register(registry);
    }

    // counts fields written, not rounds
    public void addConfigSynced(int n) { if (cConfigSynced != null && n > 0) cConfigSynced.increment(n); }
    public void addSecretsSynced(int n) { if (cSecretsSynced != null && n > 0) cSecretsSynced.increment(n); }
    public void incRegistered() { if (cRegistered != null) cRegistered.increment(); }
    public void incRegistrationFailed() { if (cRegistrationFailed != null) cRegistrationFailed.increment(); }

    public void incStepFailed(String step) {
        registry.counter(STEP_FAILED, "service", serviceName, "step", step).increment();
    }
}
