package com.myorg.scf.sidecar.client;

import com.myorg.scf.contracts.core.conventions.SidecarHeaders;
import com.myorg.scf.contracts.core.exception.SidecarRequestException;
import com.myorg.scf.contracts.core.exception.StoreUnavailableException;
import com.myorg.scf.sidecar.config.ServiceSecrets;
import com.myorg.scf.sidecar.config.SidecarProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Address and credentials of the local sidecar, shared by everything that talks to it.
 */
public class SidecarEndpoint {

    private final SidecarProperties props;
    private final ServiceSecrets secrets;

    public SidecarEndpoint(SidecarProperties props, ServiceSecrets secrets) {
        this.props = props;
        this.secrets = secrets;
    }

    public URI baseUri() {
        return URI.create(props.getScheme() + "://" + props.getHost() + ":" + props.getHttpPort());
    }

    /** Path template relative to the sidecar root, e.g. {@code /v1.0/state/{store}}. */
    public UriComponentsBuilder path(String path) {
        return UriComponentsBuilder.fromUri(baseUri()).path(path);
    }

    public HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        String token = secrets.getApiToken();
        if (token != null && !token.isBlank()) {
            h.set(SidecarHeaders.API_TOKEN, token);
        }
        return h;
    }

    /** 5xx is the sidecar's problem and may pass; other statuses mean the request itself is wrong. */
    public RuntimeException translate(String operation, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        if (e.getStatusCode().is5xxServerError()) {
            return new StoreUnavailableException(operation + " failed <" + status + ":" + e.getResponseBodyAsString() + ">", e);
        }
        return new SidecarRequestException(operation, status, e.getResponseBodyAsString());
    }

    public StoreUnavailableException unreachable(String operation, ResourceAccessException e) {
        return new StoreUnavailableException(operation + " failed: sidecar unreachable at " + baseUri(), e);
    }
}
