package com.myorg.scf.sidecar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "scf.sidecar")
public class SidecarProperties {
    private String scheme = "http";
    private String host = "localhost";
    private int httpPort = 3500;

    private Duration connectTimeout = Duration.ofSeconds(5);
    // discovery can be slow while the sidecar loads its components
    private Duration readTimeout = Duration.ofSeconds(100);

    private Discovery discovery = new Discovery();
    private Registration registration = new Registration();

    @Data
    public static class Discovery {
        // retries only while the sidecar is unreachable
        private int maxAttempts = 10;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
    }

    @Data
    public static class Registration {
        // first attempt + retries, fixed interval between them
        private int maxRetries = 5;
        private Duration interval = Duration.ofSeconds(1);
    }
}
