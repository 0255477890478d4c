package com.myorg.scf.contracts.state;

/**
 * Concurrency mode of a state write. {@link #FIRST_WRITE} requires the etag last read;
 * the store rejects the write when the etag is stale.
 */
public enum StateConcurrency {
    FIRST_WRITE("first-write"),
    LAST_WRITE("last-write"),
    UNSPECIFIED(null);

    private final String code;

    StateConcurrency(String code) {
        this.code = code;
    }

    /** Wire value, {@code null} when the option should be omitted. */
    public String code() {
        return code;
    }
}
