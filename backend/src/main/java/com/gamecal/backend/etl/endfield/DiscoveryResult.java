package com.gamecal.backend.etl.endfield;

/** Outcome of one discovery attempt: either a value or the reason there is none. */
public record DiscoveryResult(String value, String failure) {

    public static DiscoveryResult success(String value) {
        return new DiscoveryResult(value, null);
    }

    public static DiscoveryResult failure(String reason) {
        return new DiscoveryResult(null, reason);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public String orElse(String fallback) {
        return value != null ? value : fallback;
    }
}
