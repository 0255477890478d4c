package com.myorg.scf.sidecar.client;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Event to publish. Either {@code targetTopic} or {@code targetServiceId} must be set; with only the
 * service id the topic is read from that service's registration record.
 * Unset pubsub/source fields fall back to this service's own settings.
 */
@Value
@Builder
public class PublishRequest {
    Map<String, Object> payload;
    String targetTopic;
    String targetServiceId;
    String pubsubName;
    String sourceName;
    String sourceTopic;
    String eventType;
}
