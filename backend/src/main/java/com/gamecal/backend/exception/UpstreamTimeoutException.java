package com.gamecal.backend.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class UpstreamTimeoutException extends UpstreamException {

    private final Duration timeout;

    public UpstreamTimeoutException(String url, Duration timeout, Throwable cause) {
        super("Upstream request timed out after " + timeout.toMillis() + "ms", url, "UPSTREAM_TIMEOUT", cause);
        this.timeout = timeout;
    }
}
