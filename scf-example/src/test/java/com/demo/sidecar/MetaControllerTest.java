package com.demo.sidecar;

import com.myorg.scf.contracts.core.exception.RegistrationException;
import com.myorg.scf.contracts.registry.ServiceMetadataRecord;
import com.myorg.scf.sidecar.config.ServiceSecrets;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.sync.PeriodicSyncScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "scf.sync.enabled=false")
@AutoConfigureMockMvc
class MetaControllerTest {

    @TestConfiguration
    static class StubClientConfig {
        @Bean
        StubCoordinationClient stubCoordinationClient() {
            return new StubCoordinationClient();
        }
    }

    @Autowired MockMvc mvc;
    @Autowired StubCoordinationClient client;
    @Autowired ServiceSettings settings;
    @Autowired ServiceSecrets secrets;
    @Autowired ApplicationContext ctx;

    @BeforeEach
    void reset() {
        client.reset();
        settings.setConfigstoreName(null);
        settings.setSecretstoreName(null);
        settings.setStatestoreName(null);
        settings.setDebug(null);
        settings.setLogLevel(null);
        secrets.setDatabaseUser(null);
    }

    @Test
    void health_acks() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.object").value("info"))
                .andExpect(jsonPath("$.message").value("ack"))
                .andExpect(jsonPath("$.code").value(200));
    }

    @Test
    void info_describesService() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", containsString("Microservice: demo-sidecar v0.1.0")))
                .andExpect(jsonPath("$.message", containsString("Debugging: Enabled")));
    }

    @Test
    void syncConfigurations_withoutStore_isServiceUnavailable() throws Exception {
        mvc.perform(get("/sync/configurations"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.object").value("error"))
                .andExpect(jsonPath("$.message").value("Config store is not configured."));
    }

    @Test
    void syncConfigurations_reportsCounts_andUpdatesSettings() throws Exception {
        settings.setConfigstoreName("configstore");
        client.config.put("demo-sidecar_DEBUG", "false");

        mvc.perform(get("/sync/configurations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("1/4 configuration(s) synced."));

        assertThat(settings.isDebugEnabled()).isFalse();
    }

    @Test
    void syncSecrets_reportsCounts() throws Exception {
        settings.setSecretstoreName("secretstore");
        client.secrets.put("PSQL_USER", "app");

        mvc.perform(get("/sync/secrets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("1/2 secret(s) synced."));

        assertThat(secrets.getDatabaseUser()).isEqualTo("app");
    }

    @Test
    void register_succeeds_whenStateStoreDiscovered() throws Exception {
        client.discovered = ServiceMetadataRecord.builder().serviceId("demo-sidecar").stateStoreName("statestore").build();

        mvc.perform(get("/register"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Service registration successful."));

        assertThat(client.registered).hasSize(1);
        assertThat(settings.getStatestoreName()).isEqualTo("statestore");
    }

    @Test
    void register_failure_isInternalError_withoutDetails() throws Exception {
        client.discovered = ServiceMetadataRecord.builder().serviceId("demo-sidecar").stateStoreName("statestore").build();
        client.registrationFailure = new RegistrationException("Service registration failed after 6 attempts.");

        mvc.perform(get("/register"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Service registration failed."));
    }

    @Test
    void pushedConfiguration_isApplied() throws Exception {
        mvc.perform(post("/configuration/configstore/demo-sidecar_LOG_LEVEL")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"sub-1\",\"items\":{\"demo-sidecar_LOG_LEVEL\":{\"value\":\"error\",\"version\":\"2\"}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("1 configuration(s) updated."));

        assertThat(settings.getLogLevel()).hasToString("ERROR");
    }

    @Test
    void publish_toKnownPeer_returnsEventId() throws Exception {
        mvc.perform(post("/events/notify").param("type", "user.created")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user\":\"u-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.param.eventId").value("evt-1"));
    }

    @Test
    void publish_toUnknownPeer_isNotFound() throws Exception {
        mvc.perform(post("/events/ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Failed to resolve pubsub topic for ghost"));
    }

    @Test
    void scheduler_isDisabled_forThisContext() {
        assertThat(ctx.getBeansOfType(PeriodicSyncScheduler.class)).isEmpty();
    }
}
