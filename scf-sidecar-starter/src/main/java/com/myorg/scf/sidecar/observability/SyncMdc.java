package com.myorg.scf.sidecar.observability;

import org.slf4j.MDC;

public final class SyncMdc {
    public static final String SERVICE_ID = "serviceId";
    public static final String SYNC_ROUND = "syncRound";

    private SyncMdc() {}

    public static void put(String serviceId, long round) {
        if (serviceId != null) MDC.put(SERVICE_ID, serviceId);
        MDC.put(SYNC_ROUND, String.valueOf(round));
    }

    public static void clear() {
        MDC.remove(SERVICE_ID);
        MDC.remove(SYNC_ROUND);
    }
}
