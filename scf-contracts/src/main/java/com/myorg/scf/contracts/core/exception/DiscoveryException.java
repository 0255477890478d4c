package com.myorg.scf.contracts.core.exception;

// sidecar answered, but the capability listing is unusable
public class DiscoveryException extends ScfNonRetryableException {
    public DiscoveryException(String message) {
        super("DISCOVERY_FAILED", message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super("DISCOVERY_FAILED", message, cause);
    }
}
