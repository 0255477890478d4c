package com.demo.sidecar;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Body of every route: {@code {"object": "info"|"error", "message": .., "code": ..}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {
    private String object;
    private String message;
    private int code;
    private Map<String, Object> param;

    public static ResponseEntity<ApiResponse> success(String message) {
        return success(message, null);
    }

    public static ResponseEntity<ApiResponse> success(String message, Map<String, Object> param) {
        return ResponseEntity.ok(new ApiResponse("info", message, 200, param));
    }

    public static ResponseEntity<ApiResponse> error(int code, String message) {
        return ResponseEntity.status(code).body(new ApiResponse("error", message, code, null));
    }
}
