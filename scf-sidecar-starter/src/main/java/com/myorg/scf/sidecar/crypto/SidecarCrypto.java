package com.myorg.scf.sidecar.crypto;

import com.myorg.scf.contracts.core.conventions.SidecarHeaders;
import com.myorg.scf.contracts.core.exception.StoreNotConfiguredException;
import com.myorg.scf.sidecar.client.SidecarEndpoint;
import com.myorg.scf.sidecar.config.ServiceSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encrypts and decrypts through the sidecar's crypto component. Ciphertext is exchanged as base64.
 * RSA uses {@code scf.service.rsa-key-name}, AES uses {@code scf.service.aes-symmetric-key-name}.
 */
@Slf4j
@RequiredArgsConstructor
public class SidecarCrypto {

    static final String ENCRYPT_PATH = "/v1.0-alpha1/crypto/{component}/encrypt";
    static final String DECRYPT_PATH = "/v1.0-alpha1/crypto/{component}/decrypt";

    private final RestTemplate rest;
    private final SidecarEndpoint endpoint;
    private final ServiceSettings settings;

    public String encrypt(String message, KeyWrapAlgorithm algorithm) {
        HttpHeaders headers = headers(algorithm);
        headers.set(SidecarHeaders.KEY_WRAP_ALGORITHM, algorithm.name());

        byte[] cipher = exchange("Encrypt", ENCRYPT_PATH, message.getBytes(StandardCharsets.UTF_8), headers);
        return Base64.getEncoder().encodeToString(cipher);
    }

    public String decrypt(String base64Cipher, KeyWrapAlgorithm algorithm) {
        byte[] cipher = Base64.getDecoder().decode(base64Cipher);
        byte[] plain = exchange("Decrypt", DECRYPT_PATH, cipher, headers(algorithm));
        return new String(plain, StandardCharsets.UTF_8);
    }

    private HttpHeaders headers(KeyWrapAlgorithm algorithm) {
        HttpHeaders headers = endpoint.headers();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.set(SidecarHeaders.KEY_NAME, keyName(algorithm));
        return headers;
    }

    private String keyName(KeyWrapAlgorithm algorithm) {
        String name = algorithm == KeyWrapAlgorithm.RSA ? settings.getRsaKeyName() : settings.getAesSymmetricKeyName();
        if (name == null || name.isBlank()) {
            throw new IllegalStateException(algorithm + " key name is not configured.");
        }
        return name;
    }

    private byte[] exchange(String operation, String path, byte[] body, HttpHeaders headers) {
        String component = settings.getCryptoName();
        if (component == null || component.isBlank()) throw new StoreNotConfiguredException("crypto");

        URI uri = endpoint.path(path).buildAndExpand(component).encode().toUri();
        ResponseEntity<byte[]> resp;
        try {
            resp = rest.exchange(uri, HttpMethod.PUT, new HttpEntity<>(body, headers), byte[].class);
        } catch (HttpStatusCodeException e) {
            throw endpoint.translate(operation, e);
        } catch (ResourceAccessException e) {
            throw endpoint.unreachable(operation, e);
        }
        log.debug("{} via component={} done", operation, component);
        return resp.getBody() == null ? new byte[0] : resp.getBody();
    }
}
