package com.demo.sidecar;

import com.myorg.scf.contracts.core.exception.StoreNotConfiguredException;
import com.myorg.scf.contracts.core.exception.UnresolvedTopicException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(StoreNotConfiguredException.class)
    public ResponseEntity<ApiResponse> storeNotConfigured(StoreNotConfiguredException e) {
        return ApiResponse.error(HttpStatus.SERVICE_UNAVAILABLE.value(), e.getMessage());
    }

    @ExceptionHandler(UnresolvedTopicException.class)
    public ResponseEntity<ApiResponse> unresolvedTopic(UnresolvedTopicException e) {
        return ApiResponse.error(HttpStatus.NOT_FOUND.value(), e.getMessage());
    }

    // message only, the trace stays in the log
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> unexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            // framework errors (404, 405, ...) keep their own status
            int status = ((ErrorResponse) e).getStatusCode().value();
            return ApiResponse.error(status, e.getMessage());
        }
        log.error("Request failed", e);
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return ApiResponse.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Internal error: " + msg);
    }
}
