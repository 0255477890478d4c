package com.myorg.scf.contracts.core.exception;

public class UnresolvedTopicException extends ScfNonRetryableException {
    public UnresolvedTopicException(String targetServiceId) {
        super("UNRESOLVED_TOPIC", "Failed to resolve pubsub topic for " + targetServiceId);
    }
}
