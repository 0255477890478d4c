package com.myorg.scf.sidecar.config;

import com.myorg.scf.contracts.registry.ServiceMetadataRecord;
import com.myorg.scf.settings.FieldOptions;
import com.myorg.scf.settings.SyncableFieldRegistry;
import com.myorg.scf.settings.SyncableSettings;
import com.myorg.scf.settings.ValueCoercer;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Application settings of the service, shared by the coordination client, the registrar and the
 * sync scheduler.
 *
 * <p>Request handling only reads this object. It is written by the registrar (discovered component
 * names) and by config sync ({@link #syncFields()}); those fields are volatile and always replaced whole.
 */
@Data
@ConfigurationProperties(prefix = "scf.service")
public class ServiceSettings implements SyncableSettings {

    // app info; name namespaces every local remote key, do not change it at runtime
    private String name;
    private String version = "0.0.0";
    private String description = "";
    private String apiRoot = "";

    private DeploymentEnvironment env = DeploymentEnvironment.DEVELOPMENT;
    private volatile Boolean debug;
    private volatile LogLevel logLevel;

    private final Instant deployedAt = Instant.now();

    // upper bound of the jittered pause between two sync rounds
    private Duration maxSyncInterval = Duration.ofHours(12);

    private volatile Integer sidecarHealthTimeout = 60;
    private volatile String apiMethodInvocationProtocol = "grpc";

    // discovered from the sidecar; may also be preset
    private volatile String configstoreName;
    private volatile String configSubscriptionId;
    private volatile String secretstoreName;
    private volatile String secretstoreSecretName;
    private volatile String statestoreName;
    private volatile String pubsubName;
    private volatile String pubsubTopic;
    private volatile String deadLetterTopic;
    private volatile String cryptoName;

    private String rsaKeyName;
    private String aesSymmetricKeyName;

    private volatile String notifyServiceName = "notify";

    public boolean isDebugEnabled() {
        Boolean d = debug;
        return d != null ? d : env.isDebug();
    }

    public LogLevel effectiveLogLevel() {
        LogLevel l = logLevel;
        return l != null ? l : env.getLogLevel();
    }

    /** Copies every component the sidecar reported; components it did not report keep their current value. */
    public void applyDiscovered(ServiceMetadataRecord record) {
        if (record.getConfigStoreName() != null) configstoreName = record.getConfigStoreName();
        if (record.getSecretStoreName() != null) secretstoreName = record.getSecretStoreName();
        if (record.getStateStoreName() != null) statestoreName = record.getStateStoreName();
        if (record.getCryptoComponentName() != null) cryptoName = record.getCryptoComponentName();
        if (record.getPubsubName() != null) pubsubName = record.getPubsubName();
        if (record.getInboundTopic() != null) pubsubTopic = record.getInboundTopic();
        if (record.getDeadLetterTopic() != null) deadLetterTopic = record.getDeadLetterTopic();
    }

    /** Fields kept in sync with the configuration store. */
    public static SyncableFieldRegistry<ServiceSettings> syncFields() {
        return SyncableFieldRegistry.<ServiceSettings>builder()
                .field("debug", ValueCoercer.BOOLEAN, ServiceSettings::setDebug,
                        FieldOptions.sync().alias("DEBUG"))
                .field("log_level", ValueCoercer.enumOf(LogLevel.class), ServiceSettings::setLogLevel,
                        FieldOptions.sync().alias("LOG_LEVEL"))
                .field("dapr_health_timeout", ValueCoercer.INTEGER, ServiceSettings::setSidecarHealthTimeout,
                        FieldOptions.sync().global())
                .field("dapr_api_method_invocation_protocol", ValueCoercer.STRING, ServiceSettings::setApiMethodInvocationProtocol,
                        FieldOptions.sync().global())
                .field("notify_service_name", ValueCoercer.STRING, ServiceSettings::setNotifyServiceName,
                        FieldOptions.none().alias("NOTIFY_SERVICE_NAME"))
                .build();
    }
}
