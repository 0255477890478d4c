package com.myorg.scf.settings;

/**
 * Sync metadata of a declared settings field.
 *
 * <pre>
 * FieldOptions.sync().alias("DEBUG")      // remote key "&lt;service&gt;_DEBUG"
 * FieldOptions.sync().global()            // remote key "&lt;field name&gt;"
 * FieldOptions.none()                     // not synced, still applied when its key shows up
 * </pre>
 */
public record FieldOptions(String remoteAlias, boolean globalScope, boolean syncEnabled) {

    public static FieldOptions sync() {
        return new FieldOptions(null, false, true);
    }

    public static FieldOptions none() {
        return new FieldOptions(null, false, false);
    }

    public FieldOptions global() {
        return new FieldOptions(remoteAlias, true, syncEnabled);
    }

    public FieldOptions alias(String alias) {
        return new FieldOptions(alias, globalScope, syncEnabled);
    }
}
