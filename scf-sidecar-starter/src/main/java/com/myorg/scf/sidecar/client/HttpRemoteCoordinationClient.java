package com.myorg.scf.sidecar.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.scf.contracts.core.conventions.MetadataKeys;
import com.myorg.scf.contracts.core.conventions.SidecarHeaders;
import com.myorg.scf.contracts.core.exception.ConflictException;
import com.myorg.scf.contracts.core.exception.DiscoveryException;
import com.myorg.scf.contracts.core.exception.RegistrationException;
import com.myorg.scf.contracts.core.exception.SidecarRequestException;
import com.myorg.scf.contracts.core.exception.StoreNotConfiguredException;
import com.myorg.scf.contracts.core.exception.UnresolvedTopicException;
import com.myorg.scf.contracts.registry.ServiceMetadataRecord;
import com.myorg.scf.contracts.state.StateConcurrency;
import com.myorg.scf.contracts.state.StateConsistency;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link RemoteCoordinationClient} over the sidecar's HTTP API.
 *
 * <p>Error mapping: transport failure and 5xx become {@code StoreUnavailableException}, 409 on a state
 * write becomes {@code ConflictException}, any other 4xx becomes {@code SidecarRequestException}.
 */
@Slf4j
public class HttpRemoteCoordinationClient implements RemoteCoordinationClient {

    static final String METADATA_PATH = "/v1.0/metadata";
    static final String CONFIGURATION_PATH = "/v1.0/configuration/{store}";
    static final String SUBSCRIBE_PATH = "/v1.0/configuration/{store}/subscribe";
    static final String UNSUBSCRIBE_PATH = "/v1.0/configuration/{store}/{id}/unsubscribe";
    static final String SECRET_PATH = "/v1.0/secrets/{store}/{name}";
    static final String STATE_PATH = "/v1.0/state/{store}";
    static final String STATE_KEY_PATH = "/v1.0/state/{store}/{key}";
    static final String PUBLISH_PATH = "/v1.0/publish/{pubsub}/{topic}";

    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final SidecarEndpoint endpoint;
    private final ServiceSettings settings;
    private final RetryPolicy registrationRetry;

    public HttpRemoteCoordinationClient(RestTemplate rest,
                                        ObjectMapper mapper,
                                        SidecarEndpoint endpoint,
                                        ServiceSettings settings,
                                        RetryPolicy registrationRetry) {
        this.rest = rest;
        this.mapper = mapper;
        this.endpoint = endpoint;
        this.settings = settings;
        this.registrationRetry = registrationRetry;
    }

    // ---------------------------------------------------------------- discovery

    @Override
    public ServiceMetadataRecord discoverCapabilities() {
        URI uri = endpoint.path(METADATA_PATH).build().toUri();

        ResponseEntity<String> resp;
        try {
            resp = rest.exchange(uri, HttpMethod.GET, new HttpEntity<>(endpoint.headers()), String.class);
        } catch (HttpStatusCodeException e) {
            throw new DiscoveryException("Metadata resolution error <" + e.getStatusCode().value() + ":"
                    + e.getResponseBodyAsString() + ">");
        } catch (ResourceAccessException e) {
            throw endpoint.unreachable("Discovery", e);
        }

        if (!resp.getStatusCode().is2xxSuccessful()) {
            throw new DiscoveryException("Metadata resolution error <" + resp.getStatusCode().value() + ":" + resp.getBody() + ">");
        }

        JsonNode root;
        try {
            root = mapper.readTree(resp.getBody() == null ? "" : resp.getBody());
        } catch (JsonProcessingException e) {
            throw new DiscoveryException("Metadata parse error: " + e.getOriginalMessage(), e);
        }
        return parseMetadata(root);
    }

    ServiceMetadataRecord parseMetadata(JsonNode root) {
        if (root == null || !root.isObject()) throw new DiscoveryException("Metadata parse error: not a JSON object");

        ServiceMetadataRecord record = new ServiceMetadataRecord();
        record.setServiceId(required(root, "id"));

        JsonNode components = root.get("components");
        if (components == null || !components.isArray()) {
            throw new DiscoveryException("Metadata parse error: missing 'components'");
        }
        for (JsonNode c : components) {
            String type = required(c, "type");
            String name = required(c, "name");
            if (type.startsWith("configuration.")) {
                record.setConfigStoreName(name);
            } else if (type.startsWith("secretstores.")) {
                record.setSecretStoreName(name);
            } else if (type.startsWith("state.")) {
                record.setStateStoreName(name);
            } else if (type.startsWith("crypto.")) {
                record.setCryptoComponentName(name);
            }
        }

        JsonNode subscriptions = root.get("subscriptions");
        if (subscriptions != null && subscriptions.isArray()) {
            for (JsonNode s : subscriptions) {
                record.setPubsubName(required(s, "pubsubname"));
                record.setInboundTopic(required(s, "topic"));
                record.setDeadLetterTopic(required(s, "deadLetterTopic"));
            }
        }
        return record;
    }

    private static String required(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) {
            throw new DiscoveryException("Metadata parse error: missing '" + field + "'");
        }
        return v.asText();
    }

    // ---------------------------------------------------------------- configuration

    @Override
    public ConfigSyncResult syncConfig(List<String> keys, boolean subscribe) {
        String store = require(settings.getConfigstoreName(), "configstore");

        Map<String, String> values = new LinkedHashMap<>();
        try {
            URI uri = endpoint.path(CONFIGURATION_PATH).queryParam("key", keys).buildAndExpand(store).encode().toUri();
            JsonNode body = getJson("Configuration read", uri);
            readConfigurationItems(body, values);
            log.info("Found {}/{} configurations, syncing...", values.size(), keys.size());
        } catch (RuntimeException e) {
            log.error("Failed to get configurations from store={}", store, e);
        }

        String subscriptionId = null;
        if (subscribe) {
            try {
                URI uri = endpoint.path(SUBSCRIBE_PATH).queryParam("key", keys).buildAndExpand(store).encode().toUri();
                JsonNode body = getJson("Configuration subscribe", uri);
                JsonNode id = body == null ? null : body.get("id");
                subscriptionId = (id == null || id.isNull()) ? null : id.asText();
                log.info("Subscribed to config store={} subscriptionId={}", store, subscriptionId);
            } catch (RuntimeException e) {
                log.error("Failed to subscribe to config store={}", store, e);
            }
        }
        return new ConfigSyncResult(values, subscriptionId);
    }

    // sidecar answers {"key": {"value": ..}}; older versions a list of {"key":..,"value":..}
    private void readConfigurationItems(JsonNode body, Map<String, String> out) {
        if (body == null) return;
        if (body.isArray()) {
            for (JsonNode item : body) {
                if (item.hasNonNull("key")) out.put(item.get("key").asText(), textOrNull(item.get("value")));
            }
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = body.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            out.put(e.getKey(), v != null && v.isObject() ? textOrNull(v.get("value")) : textOrNull(v));
        }
    }

    @Override
    public boolean unsubscribeConfig(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) return false;
        String store = settings.getConfigstoreName();
        if (store == null || store.isBlank()) {
            log.warn("Cannot unsubscribe id={}: configstore is not configured", subscriptionId);
            return false;
        }
        try {
            URI uri = endpoint.path(UNSUBSCRIBE_PATH).buildAndExpand(store, subscriptionId).encode().toUri();
            JsonNode body = getJson("Configuration unsubscribe", uri);
            boolean ok = body == null || !body.has("ok") || body.get("ok").asBoolean();
            log.debug("Unsubscribed id={} ok={}", subscriptionId, ok);
            return ok;
        } catch (RuntimeException e) {
            log.error("Failed to unsubscribe id={} from config store={}", subscriptionId, store, e);
            return false;
        }
    }

    // ---------------------------------------------------------------- secrets

    @Override
    public Map<String, String> syncSecrets(List<String> keys) {
        String store = require(settings.getSecretstoreName(), "secretstore");
        String secretName = settings.getSecretstoreSecretName();

        Map<String, String> secrets = new LinkedHashMap<>();
        for (String key : keys) {
            try {
                String name = (secretName == null || secretName.isBlank()) ? key : secretName;
                URI uri = endpoint.path(SECRET_PATH).buildAndExpand(store, name).encode().toUri();
                JsonNode body = getJson("Secret read", uri);
                String value = body == null ? null : textOrNull(body.get(key));
                if (value != null) secrets.put(key, value);
            } catch (RuntimeException e) {
                log.error("Failed to get secret key={}: {}", key, e.getMessage());
            }
        }
        log.info("Found {}/{} secrets, syncing...", secrets.size(), keys.size());
        return secrets;
    }

    // ---------------------------------------------------------------- state

    @Override
    public void writeState(StateWriteRequest request) {
        String store = require(firstNonBlank(request.getStoreName(), settings.getStatestoreName()), "statestore");
        String key = request.getKey();

        String etag = request.getEtag();
        if (etag == null && !request.isSkipEtagIfUnset()) {
            etag = fetchEtag(store, key);
        }

        Map<String, Object> item = new LinkedHashMap<>();
        item.put("key", key);

        Map<String, String> metadata = new LinkedHashMap<>();
        Object value = request.getValue();
        if (value instanceof String) {
            item.put("value", value);
        } else {
            item.put("value", mapper.valueToTree(value));
            metadata.put(MetadataKeys.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        }
        if (request.getTtlSeconds() != null) {
            metadata.put(MetadataKeys.TTL_IN_SECONDS, String.valueOf(request.getTtlSeconds()));
        }
        if (etag != null) item.put("etag", etag);

        Map<String, String> options = stateOptions(request.getConcurrency(), request.getConsistency());
        if (!options.isEmpty()) item.put("options", options);
        if (!metadata.isEmpty()) item.put("metadata", metadata);

        URI uri = endpoint.path(STATE_PATH).buildAndExpand(store).encode().toUri();
        HttpHeaders headers = endpoint.headers();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            rest.exchange(uri, HttpMethod.POST, new HttpEntity<>(toJson(List.of(item)), headers), Void.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                throw new ConflictException(store, key, e.getResponseBodyAsString());
            }
            throw endpoint.translate("State write", e);
        } catch (ResourceAccessException e) {
            throw endpoint.unreachable("State write", e);
        }
        log.debug("State saved store={} key={} etag={}", store, key, etag);
    }

    private static Map<String, String> stateOptions(StateConcurrency concurrency, StateConsistency consistency) {
        Map<String, String> options = new LinkedHashMap<>();
        if (concurrency != null && concurrency.code() != null) options.put("concurrency", concurrency.code());
        if (consistency != null && consistency.code() != null) options.put("consistency", consistency.code());
        return options;
    }

    private String fetchEtag(String store, String key) {
        ResponseEntity<String> resp = getState(store, key);
        return resp.getHeaders().getFirst(HttpHeaders.ETAG);
    }

    private ResponseEntity<String> getState(String store, String key) {
        URI uri = endpoint.path(STATE_KEY_PATH).buildAndExpand(store, key).encode().toUri();
        try {
            return rest.exchange(uri, HttpMethod.GET, new HttpEntity<>(endpoint.headers()), String.class);
        } catch (HttpStatusCodeException e) {
            throw endpoint.translate("State read", e);
        } catch (ResourceAccessException e) {
            throw endpoint.unreachable("State read", e);
        }
    }

    @Override
    public Optional<String> readState(String storeName, String key) {
        String store = require(firstNonBlank(storeName, settings.getStatestoreName()), "statestore");
        ResponseEntity<String> resp = getState(store, key);
        String body = resp.getBody();
        if (resp.getStatusCode().value() == HttpStatus.NO_CONTENT.value() || body == null || body.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(body);
    }

    @Override
    public Optional<ServiceMetadataRecord> getServiceMetadata(String serviceId) {
        String store = require(settings.getStatestoreName(), "statestore");
        try {
            Optional<String> raw = readState(store, MetadataKeys.serviceRecordKey(serviceId));
            if (raw.isEmpty()) return Optional.empty();

            JsonNode node = mapper.readTree(raw.get());
            // records written by peers as a JSON string
            if (node.isTextual()) node = mapper.readTree(node.asText());
            return Optional.of(mapper.treeToValue(node, ServiceMetadataRecord.class));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to get service metadata for serviceId={}", serviceId, e);
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------- registration

    @Override
    public void registerService(ServiceMetadataRecord record) {
        StateWriteRequest write = StateWriteRequest.builder()
                .storeName(record.getStateStoreName())
                .key(record.storeKey())
                .value(record)
                .concurrency(StateConcurrency.FIRST_WRITE)
                .consistency(StateConsistency.STRONG)
                .build();
        try {
            registrationRetry.execute(() -> {
                writeState(write);
                return null;
            });
        } catch (RuntimeException e) {
            throw new RegistrationException("Service registration failed after "
                    + registrationRetry.getMaxAttempts() + " attempts.", e);
        }
        log.info("Service registration successful serviceId={}", record.getServiceId());
    }

    // ---------------------------------------------------------------- pub/sub

    @Override
    public String publish(PublishRequest request) {
        if (isBlank(request.getTargetTopic()) && isBlank(request.getTargetServiceId())) {
            throw new IllegalArgumentException("Either targetTopic or targetServiceId is required.");
        }
        String sourceName = firstNonBlank(request.getSourceName(), settings.getName());
        if (isBlank(sourceName)) throw new IllegalArgumentException("Source name is not set");

        String topic = request.getTargetTopic();
        if (isBlank(topic)) {
            topic = getServiceMetadata(request.getTargetServiceId())
                    .map(ServiceMetadataRecord::getInboundTopic)
                    .filter(t -> !t.isBlank())
                    .orElseThrow(() -> new UnresolvedTopicException(request.getTargetServiceId()));
        }
        String pubsub = require(firstNonBlank(request.getPubsubName(), settings.getPubsubName()), "pubsub");
        String sourceTopic = firstNonBlank(request.getSourceTopic(), settings.getPubsubTopic());

        String eventId = UUID.randomUUID().toString();

        Map<String, Object> data = new LinkedHashMap<>();
        if (request.getPayload() != null) data.putAll(request.getPayload());
        data.put(MetadataKeys.PAYLOAD_SOURCE, sourceName);
        data.put(MetadataKeys.PAYLOAD_SOURCE_TOPIC, sourceTopic);
        if (data.get(MetadataKeys.PAYLOAD_TYPE) == null && request.getEventType() != null) {
            data.put(MetadataKeys.PAYLOAD_TYPE, request.getEventType());
        }

        UriComponentsBuilder b = endpoint.path(PUBLISH_PATH)
                .queryParam("metadata." + MetadataKeys.CLOUDEVENT_ID, eventId)
                .queryParam("metadata." + MetadataKeys.CLOUDEVENT_SOURCE, sourceName);
        if (request.getEventType() != null) {
            b.queryParam("metadata." + MetadataKeys.CLOUDEVENT_TYPE, request.getEventType());
        }
        URI uri = b.buildAndExpand(pubsub, topic).encode().toUri();

        HttpHeaders headers = endpoint.headers();
        headers.setContentType(new MediaType(MediaType.parseMediaType(SidecarHeaders.CLOUDEVENTS_CONTENT_TYPE), StandardCharsets.UTF_8));

        try {
            rest.exchange(uri, HttpMethod.POST, new HttpEntity<>(toJson(data), headers), Void.class);
        } catch (HttpStatusCodeException e) {
            throw endpoint.translate("Publish", e);
        } catch (ResourceAccessException e) {
            throw endpoint.unreachable("Publish", e);
        }

        log.info("Published to pubsub topic {}/{} eventId={}", pubsub, topic, eventId);
        return eventId;
    }

    // ---------------------------------------------------------------- helpers

    JsonNode getJson(String operation, URI uri) {
        ResponseEntity<String> resp;
        try {
            resp = rest.exchange(uri, HttpMethod.GET, new HttpEntity<>(endpoint.headers()), String.class);
        } catch (HttpStatusCodeException e) {
            throw endpoint.translate(operation, e);
        } catch (ResourceAccessException e) {
            throw endpoint.unreachable(operation, e);
        }
        String body = resp.getBody();
        if (body == null || body.isBlank()) return null;
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw SidecarRequestException.unreadable(operation, resp.getStatusCode().value(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize value: " + e.getOriginalMessage(), e);
        }
    }

    private static String require(String name, String kind) {
        if (isBlank(name)) throw new StoreNotConfiguredException(kind);
        return name;
    }

    private static String textOrNull(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }

    private static String firstNonBlank(String a, String b) {
        return isBlank(a) ? b : a;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
