package com.demo.sidecar;

import com.myorg.scf.sidecar.client.PublishRequest;
import com.myorg.scf.sidecar.client.RemoteCoordinationClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class EventsController {

    private final RemoteCoordinationClient client;

    // topic is looked up from the target's registration record
    @PostMapping("/events/{serviceId}")
    public ResponseEntity<ApiResponse> publish(@PathVariable("serviceId") String serviceId,
                                               @RequestParam(name = "type", required = false) String type,
                                               @RequestBody Map<String, Object> payload) {
        String eventId = client.publish(PublishRequest.builder()
                .targetServiceId(serviceId)
                .payload(payload)
                .eventType(type)
                .build());
        return ApiResponse.success("Published.", Map.of("eventId", eventId));
    }
}
