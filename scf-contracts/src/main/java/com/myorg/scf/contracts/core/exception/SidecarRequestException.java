package com.myorg.scf.contracts.core.exception;

import lombok.Getter;

// 4xx other than a conflict, or an unreadable answer: repeating the request will not help
@Getter
public class SidecarRequestException extends ScfNonRetryableException {
    private final int status;

    public SidecarRequestException(String operation, int status, String body) {
        super("SIDECAR_REJECTED", operation + " rejected by sidecar <" + status + ":" + (body == null ? "" : body) + ">");
        this.status = status;
    }

    private SidecarRequestException(String reason, String message, int status, Throwable cause) {
        super(reason, message, cause);
        this.status = status;
    }

    // sidecar answered with a success status but a body that is not the expected JSON
    public static SidecarRequestException unreadable(String operation, int status, Throwable cause) {
        return new SidecarRequestException("SIDECAR_UNREADABLE", operation + ": unreadable sidecar response <"
                + status + ":" + cause.getMessage() + ">", status, cause);
    }
}
