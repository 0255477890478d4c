package com.myorg.scf.contracts.core.conventions;

public final class MetadataKeys {
    private MetadataKeys() {}

    // state store key holding a service's registration record: "__metadata__" + serviceId
    public static final String SERVICE_RECORD_PREFIX = "__metadata__";

    public static final String TTL_IN_SECONDS = "ttlInSeconds";
    public static final String CONTENT_TYPE = "contentType";

    public static final String CLOUDEVENT_ID = "cloudevent.id";
    public static final String CLOUDEVENT_SOURCE = "cloudevent.source";
    public static final String CLOUDEVENT_TYPE = "cloudevent.type";

    // fields stamped on every published payload
    public static final String PAYLOAD_SOURCE = "source";
    public static final String PAYLOAD_SOURCE_TOPIC = "source_topic";
    public static final String PAYLOAD_TYPE = "type";

    public static String serviceRecordKey(String serviceId) {
        return SERVICE_RECORD_PREFIX + serviceId;
    }
}
