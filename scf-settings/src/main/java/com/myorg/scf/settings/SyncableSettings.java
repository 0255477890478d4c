package com.myorg.scf.settings;

/**
 * A settings object whose fields can be synchronized from a remote store.
 * The name namespaces every non-global remote key and must not change once the process runs.
 */
public interface SyncableSettings {
    String getName();
}
