package com.gamecal.backend.exception;

import lombok.Getter;

/**
 * Failure talking to a publisher endpoint. Primary-source failures propagate to the caller;
 * secondary sources catch this at the point of use.
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final String url;
    private final String errorCode;

    public UpstreamException(String message, String url, String errorCode, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? "UPSTREAM_IO" : errorCode;
    }

    public UpstreamException(String message, String url, Throwable cause) {
        this(message, url, "UPSTREAM_IO", cause);
    }
}
