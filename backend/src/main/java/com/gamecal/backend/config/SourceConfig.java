package com.gamecal.backend.config;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of upstream overrides. A missing or blank key means "use the built-in default".
 */
public final class SourceConfig {

    private static final SourceConfig EMPTY = new SourceConfig(Map.of());

    private final Map<SourceKey, String> overrides;

    private SourceConfig(Map<SourceKey, String> overrides) {
        EnumMap<SourceKey, String> copy = new EnumMap<>(SourceKey.class);
        overrides.forEach((k, v) -> {
            if (k != null && v != null && !v.isBlank()) copy.put(k, v.trim());
        });
        this.overrides = copy;
    }

    public static SourceConfig empty() {
        return EMPTY;
    }

    public static SourceConfig of(Map<SourceKey, String> overrides) {
        return overrides == null || overrides.isEmpty() ? EMPTY : new SourceConfig(overrides);
    }

    public Optional<String> get(SourceKey key) {
        return Optional.ofNullable(overrides.get(key));
    }

    public String getOrDefault(SourceKey key, String defaultValue) {
        return overrides.getOrDefault(key, defaultValue);
    }

    @Override
    public String toString() {
        return "SourceConfig" + overrides.keySet();
    }
}
