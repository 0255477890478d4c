package com.myorg.scf.sidecar.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.scf.contracts.core.exception.StoreUnavailableException;
import com.myorg.scf.sidecar.client.HttpRemoteCoordinationClient;
import com.myorg.scf.sidecar.client.RemoteCoordinationClient;
import com.myorg.scf.sidecar.client.SidecarEndpoint;
import com.myorg.scf.sidecar.config.ServiceSecrets;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.config.SidecarProperties;
import com.myorg.scf.sidecar.config.SyncProperties;
import com.myorg.scf.sidecar.crypto.SidecarCrypto;
import com.myorg.scf.sidecar.observability.SyncMetrics;
import com.myorg.scf.sidecar.registry.ServiceRegistrar;
import com.myorg.scf.sidecar.retry.RetryPolicy;
import com.myorg.scf.sidecar.sync.DependentRuntime;
import com.myorg.scf.sidecar.sync.PeriodicSyncScheduler;
import com.myorg.scf.sidecar.sync.SettingsSynchronizer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.util.Random;

@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.web.client.RestTemplateAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@ConditionalOnClass(RestTemplate.class)
@EnableConfigurationProperties({
        ServiceSettings.class,
        ServiceSecrets.class,
        SidecarProperties.class,
        SyncProperties.class
})
public class ScfSidecarAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SidecarEndpoint sidecarEndpoint(SidecarProperties props,
                                           ServiceSettings settings,
                                           ServiceSecrets secrets,
                                           Environment env) {
        resolveServiceName(settings, secrets, env);
        return new SidecarEndpoint(props, secrets);
    }

    @Bean
    @ConditionalOnMissingBean
    public RemoteCoordinationClient remoteCoordinationClient(SidecarEndpoint endpoint,
                                                             SidecarProperties props,
                                                             ServiceSettings settings,
                                                             ObjectProvider<RestTemplateBuilder> builderProvider,
                                                             ObjectProvider<ObjectMapper> mapperProvider) {
        var reg = props.getRegistration();
        RetryPolicy registrationRetry = RetryPolicy.fixed("registration", 1 + reg.getMaxRetries(), reg.getInterval());

        return new HttpRemoteCoordinationClient(
                sidecarRestTemplate(builderProvider, props),
                mapperProvider.getIfAvailable(ObjectMapper::new),
                endpoint,
                settings,
                registrationRetry
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public SidecarCrypto sidecarCrypto(SidecarEndpoint endpoint,
                                       SidecarProperties props,
                                       ServiceSettings settings,
                                       ObjectProvider<RestTemplateBuilder> builderProvider) {
        return new SidecarCrypto(sidecarRestTemplate(builderProvider, props), endpoint, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceRegistrar serviceRegistrar(RemoteCoordinationClient client,
                                             ServiceSettings settings,
                                             SidecarProperties props,
                                             ObjectProvider<SyncMetrics> metricsProvider) {
        var d = props.getDiscovery();
        RetryPolicy discoveryRetry = RetryPolicy.builder()
                .name("discovery")
                .maxAttempts(d.getMaxAttempts())
                .baseDelay(d.getBaseDelay())
                .backoffFactor(d.getBackoffFactor())
                .retryOn(StoreUnavailableException.class)
                .build();
        return new ServiceRegistrar(client, settings, discoveryRetry, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public SettingsSynchronizer settingsSynchronizer(RemoteCoordinationClient client,
                                                     ServiceSettings settings,
                                                     ServiceSecrets secrets,
                                                     SyncProperties props,
                                                     ObjectProvider<SyncMetrics> metricsProvider) {
        return new SettingsSynchronizer(client, settings, secrets,
                ServiceSettings.syncFields(), ServiceSecrets.syncFields(),
                props, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "scf.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PeriodicSyncScheduler periodicSyncScheduler(ServiceRegistrar registrar,
                                                       SettingsSynchronizer synchronizer,
                                                       ObjectProvider<DependentRuntime> runtimes,
                                                       ServiceSettings settings,
                                                       SyncProperties props,
                                                       ObjectProvider<SyncMetrics> metricsProvider) {
        return new PeriodicSyncScheduler(registrar, synchronizer, runtimes.orderedStream().toList(),
                settings, props, metricsProvider.getIfAvailable(), new Random());
    }

    // ---------------- metrics (only with Micrometer on the classpath) ----------------

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class SyncMetricsConfig {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public SyncMetrics syncMetrics(MeterRegistry registry, ServiceSettings settings, Environment env) {
            String service = StringUtils.hasText(settings.getName())
                    ? settings.getName()
                    : env.getProperty("spring.application.name", "unknown-service");
            return new SyncMetrics(registry, service);
        }

        /**
         * Pre-register meters at startup so they read 0 before the first round.
         */
        @Bean
        public SmartLifecycle scfMetricsPreRegisterLifecycle(ObjectProvider<SyncMetrics> metricsProvider) {
            return new SmartLifecycle() {
                private boolean running = false;

                @Override public void start() {
                    SyncMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegister();
                    running = true;
                }

                @Override public void stop() { running = false; }
                @Override public boolean isRunning() { return running; }
                @Override public int getPhase() { return Integer.MIN_VALUE; }
            };
        }
    }

    private static RestTemplate sidecarRestTemplate(ObjectProvider<RestTemplateBuilder> builderProvider,
                                                    SidecarProperties props) {
        return builderProvider.getIfAvailable(RestTemplateBuilder::new)
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }

    // scf.service.name -> spring.application.name; scf.secrets.name -> scf.service.name
    private static void resolveServiceName(ServiceSettings settings, ServiceSecrets secrets, Environment env) {
        if (!StringUtils.hasText(settings.getName())) {
            String app = env.getProperty("spring.application.name");
            if (!StringUtils.hasText(app)) {
                throw new IllegalStateException("scf.service.name (or spring.application.name) is required.");
            }
            settings.setName(app);
        }
        if (!StringUtils.hasText(secrets.getName())) {
            secrets.setName(settings.getName());
        }
        log.debug("Sidecar coordination for serviceId={}", settings.getName());
    }
}
