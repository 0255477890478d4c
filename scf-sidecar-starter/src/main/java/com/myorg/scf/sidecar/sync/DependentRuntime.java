package com.myorg.scf.sidecar.sync;

/**
 * Component that needs the sidecar and is (re)started on every sync round, e.g. a workflow runtime.
 * {@link #start()} must be safe to call again when already running.
 */
public interface DependentRuntime {

    String name();

    void start() throws Exception;

    default void shutdown() {
    }
}
