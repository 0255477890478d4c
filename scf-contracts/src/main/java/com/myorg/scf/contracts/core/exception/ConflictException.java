package com.myorg.scf.contracts.core.exception;

import lombok.Getter;

/**
 * The state store rejected a write because the supplied etag is no longer current.
 * Never retried by the coordination client: whether to re-read and write again is the caller's decision.
 */
@Getter
public class ConflictException extends ScfNonRetryableException {
    private final String storeName;
    private final String key;

    public ConflictException(String storeName, String key, String detail) {
        super("ETAG_CONFLICT", "Etag mismatch writing key=" + key + " to store=" + storeName
                + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.storeName = storeName;
        this.key = key;
    }
}
