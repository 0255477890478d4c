package com.demo.sidecar;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.scf.sidecar.client.SyncOutcome;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.registry.ServiceRegistrar;
import com.myorg.scf.sidecar.sync.SettingsSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service info, manual sync and registration, and the callback the sidecar pushes config changes to.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class MetaController {

    private final ServiceSettings settings;
    private final SettingsSynchronizer synchronizer;
    private final ServiceRegistrar registrar;

    @GetMapping("/")
    public ResponseEntity<ApiResponse> info() {
        Duration up = Duration.between(settings.getDeployedAt(), Instant.now());
        String info = "Microservice: " + settings.getName() + " v" + settings.getVersion() + "\n"
                + "Description: " + settings.getDescription() + "\n"
                + "Environment: " + settings.getEnv() + "\n"
                + "Debugging: " + (settings.isDebugEnabled() ? "Enabled" : "Disabled") + "\n"
                + "Deployed at: " + settings.getDeployedAt() + "\n"
                + "Uptime: " + up.toHours() + "h:" + up.toMinutesPart() + "m:" + up.toSecondsPart() + "s";
        return ApiResponse.success(info);
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse> health() {
        return ApiResponse.success("ack");
    }

    @GetMapping("/sync/configurations")
    public ResponseEntity<ApiResponse> syncConfigurations() {
        SyncOutcome o = synchronizer.syncConfigurations();
        return ApiResponse.success(o.synced() + "/" + o.requested() + " configuration(s) synced.");
    }

    @GetMapping("/sync/secrets")
    public ResponseEntity<ApiResponse> syncSecrets() {
        SyncOutcome o = synchronizer.syncSecrets();
        return ApiResponse.success(o.synced() + "/" + o.requested() + " secret(s) synced.");
    }

    @GetMapping("/register")
    public ResponseEntity<ApiResponse> register() {
        try {
            registrar.bootstrap(true);
            return ApiResponse.success("Service registration successful.");
        } catch (RuntimeException e) {
            log.error("Service registration failed with {}", e.toString(), e);
            return ApiResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Service registration failed.");
        }
    }

    /**
     * Config store change notification: {@code {"id": .., "items": {"<key>": {"value": ..}}}}.
     */
    @PostMapping("/configuration/{store}/{key}")
    public ResponseEntity<ApiResponse> configurationChanged(@PathVariable("store") String store,
                                                            @PathVariable("key") String key,
                                                            @RequestBody JsonNode body) {
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode items = body.path("items");
        Iterator<Map.Entry<String, JsonNode>> it = items.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue().path("value");
            if (!v.isMissingNode() && !v.isNull()) values.put(e.getKey(), v.asText());
        }
        log.debug("Config update from store={} key={} subscription={} items={}",
                store, key, body.path("id").asText(null), values.keySet());

        int applied = synchronizer.applyConfigurationUpdate(values);
        return ApiResponse.success(applied + " configuration(s) updated.");
    }
}
