package com.myorg.scf.sidecar.client;

public record SyncOutcome(int synced, int requested) {
}
