package com.myorg.scf.settings;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * One row of a {@link SyncableFieldRegistry}: how to name a field remotely and how to write it back.
 *
 * @param <S> settings type
 * @param <T> declared field type
 */
public final class SettingsField<S, T> {

    private final String name;
    private final FieldOptions options;
    private final ValueCoercer<T> coercer;
    private final BiConsumer<S, T> setter;

    SettingsField(String name, FieldOptions options, ValueCoercer<T> coercer, BiConsumer<S, T> setter) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("field name must not be blank");
        this.name = name;
        this.options = Objects.requireNonNull(options, "options");
        this.coercer = Objects.requireNonNull(coercer, "coercer");
        this.setter = Objects.requireNonNull(setter, "setter");
    }

    public String name() {
        return name;
    }

    public FieldOptions options() {
        return options;
    }

    public boolean syncEnabled() {
        return options.syncEnabled();
    }

    /** {@code (global ? "" : serviceName + "_") + (alias or name)}. */
    public String remoteKey(String serviceName) {
        String base = options.remoteAlias() != null ? options.remoteAlias() : name;
        return options.globalScope() ? base : serviceName + "_" + base;
    }

    /** Coerces {@code raw} and writes it onto {@code settings}. Coercion errors propagate. */
    void apply(S settings, String raw) {
        setter.accept(settings, coercer.coerce(raw));
    }

    @Override
    public String toString() {
        return "SettingsField{" + name + ", " + options + "}";
    }
}
