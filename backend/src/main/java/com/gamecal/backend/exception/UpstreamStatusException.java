package com.gamecal.backend.exception;

import lombok.Getter;

@Getter
public class UpstreamStatusException extends UpstreamException {

    private static final int MAX_SNIPPET = 200;

    private final int statusCode;
    private final String bodySnippet;

    public UpstreamStatusException(String url, int statusCode, String body) {
        super("Upstream error " + statusCode + ": " + snippet(body), url, "UPSTREAM_STATUS", null);
        this.statusCode = statusCode;
        this.bodySnippet = snippet(body);
    }

    private static String snippet(String body) {
        if (body == null) return "";
        return body.length() <= MAX_SNIPPET ? body : body.substring(0, MAX_SNIPPET);
    }
}
