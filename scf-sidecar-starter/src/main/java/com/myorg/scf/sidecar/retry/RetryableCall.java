package com.myorg.scf.sidecar.retry;

@FunctionalInterface
public interface RetryableCall<T, E extends Exception> {
    T call() throws E;
}
