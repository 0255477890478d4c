package com.myorg.scf.settings;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Static table of the fields of a settings type that take part in remote sync.
 *
 * <p>Built once at startup; no reflection. Decides which remote keys to ask a store for
 * ({@link #fieldsToSync}) and writes fetched values back ({@link #applyValues}).
 *
 * <pre>
 * SyncableFieldRegistry.&lt;AppSettings&gt;builder()
 *         .field("debug", ValueCoercer.BOOLEAN, AppSettings::setDebug, FieldOptions.sync().alias("DEBUG"))
 *         .field("timeout", ValueCoercer.INTEGER, AppSettings::setTimeout, FieldOptions.sync().global())
 *         .build();
 * </pre>
 */
@Slf4j
public final class SyncableFieldRegistry<S extends SyncableSettings> {

    private final List<SettingsField<S, ?>> fields;

    private SyncableFieldRegistry(List<SettingsField<S, ?>> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static <S extends SyncableSettings> Builder<S> builder() {
        return new Builder<>();
    }

    public List<SettingsField<S, ?>> fields() {
        return fields;
    }

    /**
     * Remote keys of every sync-enabled field, in declaration order. Not de-duplicated.
     */
    public List<String> fieldsToSync(S settings) {
        String serviceName = settings.getName();
        List<String> keys = new ArrayList<>();
        for (SettingsField<S, ?> f : fields) {
            if (f.syncEnabled()) {
                keys.add(f.remoteKey(serviceName));
            }
        }
        return keys;
    }

    /**
     * Writes every value whose key matches a declared field's remote key.
     * Fields without a matching key are left alone; a value that cannot be coerced is logged and skipped.
     *
     * @return number of fields written
     */
    public int applyValues(S settings, Map<String, String> mapping) {
        if (mapping == null || mapping.isEmpty()) return 0;

        String serviceName = settings.getName();
        int applied = 0;
        for (SettingsField<S, ?> f : fields) {
            String key = f.remoteKey(serviceName);
            if (!mapping.containsKey(key)) continue;

            try {
                f.apply(settings, mapping.get(key));
                applied++;
            } catch (RuntimeException e) {
                log.warn("Skip field={} key={}: cannot coerce remote value ({})", f.name(), key, e.toString());
            }
        }
        return applied;
    }

    public static final class Builder<S extends SyncableSettings> {
        private final List<SettingsField<S, ?>> fields = new ArrayList<>();

        private Builder() {}

        public <T> Builder<S> field(String name, ValueCoercer<T> coercer, BiConsumer<S, T> setter, FieldOptions options) {
            fields.add(new SettingsField<>(name, options, coercer, setter));
            return this;
        }

        public SyncableFieldRegistry<S> build() {
            return new SyncableFieldRegistry<>(fields);
        }
    }
}
