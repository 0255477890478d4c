package com.myorg.scf.contracts.core.conventions;

public final class SidecarHeaders {
    private SidecarHeaders() {}

    public static final String API_TOKEN = "dapr-api-token";
    public static final String KEY_NAME = "dapr-key-name";
    public static final String KEY_WRAP_ALGORITHM = "dapr-key-wrap-algorithm";

    public static final String CLOUDEVENTS_CONTENT_TYPE = "application/cloudevents+json";
}
