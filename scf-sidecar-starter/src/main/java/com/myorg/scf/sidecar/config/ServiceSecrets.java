package com.myorg.scf.sidecar.config;

import com.myorg.scf.settings.FieldOptions;
import com.myorg.scf.settings.SyncableFieldRegistry;
import com.myorg.scf.settings.SyncableSettings;
import com.myorg.scf.settings.ValueCoercer;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Secrets of the service. {@code apiToken} authenticates calls to the sidecar and is never synced;
 * the fields in {@link #syncFields()} are refreshed from the secret store.
 */
@Data
@ConfigurationProperties(prefix = "scf.secrets")
public class ServiceSecrets implements SyncableSettings {

    // empty -> inherits scf.service.name
    private String name;

    @ToString.Exclude
    private String apiToken;

    @ToString.Exclude
    private volatile String databaseUser;
    @ToString.Exclude
    private volatile String databasePassword;

    public static SyncableFieldRegistry<ServiceSecrets> syncFields() {
        return SyncableFieldRegistry.<ServiceSecrets>builder()
                .field("database_user", ValueCoercer.STRING, ServiceSecrets::setDatabaseUser,
                        FieldOptions.sync().global().alias("PSQL_USER"))
                .field("database_password", ValueCoercer.STRING, ServiceSecrets::setDatabasePassword,
                        FieldOptions.sync().global().alias("PSQL_PASSWORD"))
                .build();
    }
}
