package com.myorg.scf.contracts.core.exception;

public class ScfRetryableException extends RuntimeException {
    public ScfRetryableException(String msg) { super(msg); }
    public ScfRetryableException(String msg, Throwable cause) { super(msg, cause); }
}
