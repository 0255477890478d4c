package com.myorg.scf.contracts.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.scf.contracts.core.conventions.MetadataKeys;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Topology snapshot of one service as discovered from its sidecar.
 *
 * <p>Stored in the shared state store under {@link #storeKey()} and read by peers to find
 * the service's inbound topic. A {@code null} component means "not provisioned".
 * Property names match the record format peers already read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceMetadataRecord {
    @JsonProperty("app_name")
    private String serviceId;

    @JsonProperty("configstore")
    private String configStoreName;

    @JsonProperty("secretstore")
    private String secretStoreName;

    @JsonProperty("statestore")
    private String stateStoreName;

    @JsonProperty("pubsub")
    private String pubsubName;

    @JsonProperty("topic")
    private String inboundTopic;

    @JsonProperty("deadletter")
    private String deadLetterTopic;

    @JsonProperty("crypto")
    private String cryptoComponentName;

    @JsonIgnore
    public String storeKey() {
        return MetadataKeys.serviceRecordKey(serviceId);
    }
}
