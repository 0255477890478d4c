package com.myorg.scf.contracts.core.exception;

import lombok.Getter;

// nothing of this kind was discovered on the sidecar (or configured explicitly)
@Getter
public class StoreNotConfiguredException extends ScfNonRetryableException {
    private final String storeKind;

    public StoreNotConfiguredException(String storeKind) {
        super("STORE_NOT_CONFIGURED", storeKind + " is not configured.");
        this.storeKind = storeKind;
    }
}
