package com.myorg.scf.contracts.core.exception;

public class RegistrationException extends ScfNonRetryableException {
    public RegistrationException(String message) {
        super("REGISTRATION_FAILED", message);
    }

    public RegistrationException(String message, Throwable cause) {
        super("REGISTRATION_FAILED", message, cause);
    }
}
