package com.myorg.scf.sidecar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "scf.sync")
public class SyncProperties {
    // starts the background scheduler
    private boolean enabled = true;

    // gives the sidecar time to load its components before the first discovery
    private Duration warmUpDelay = Duration.ofSeconds(3);
    private Duration settleDelay = Duration.ofMillis(1500);

    private boolean register = true;

    // subscribe once to config store changes; updates are pushed to the app
    private boolean subscribeConfigChanges = false;

    // how long stop() waits for an in-flight round to finish
    private Duration shutdownTimeout = Duration.ofSeconds(10);
}
