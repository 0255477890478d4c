package com.myorg.scf.contracts.core.exception;

// sidecar unreachable, timed out or answered 5xx; safe to retry under a bounded policy
public class StoreUnavailableException extends ScfRetryableException {
    public StoreUnavailableException(String msg) { super(msg); }
    public StoreUnavailableException(String msg, Throwable cause) { super(msg, cause); }
}
