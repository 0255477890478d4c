package com.myorg.scf.sidecar.config;

/**
 * Where the service runs; supplies the defaults for {@code debug} and {@code logLevel}
 * when neither is set explicitly.
 */
public enum DeploymentEnvironment {
    DEVELOPMENT(true, LogLevel.DEBUG),
    STAGING(false, LogLevel.INFO),
    PRODUCTION(false, LogLevel.INFO);

    private final boolean debug;
    private final LogLevel logLevel;

    DeploymentEnvironment(boolean debug, LogLevel logLevel) {
        this.debug = debug;
        this.logLevel = logLevel;
    }

    public boolean isDebug() {
        return debug;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }
}
