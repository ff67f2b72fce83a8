package com.gamecal.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Configuration
public class SourceConfigFactory {

    static final String PREFIX = "app.upstream.";

    @Bean
    public SourceConfig sourceConfig(Environment env) {
        Map<SourceKey, String> overrides = new EnumMap<>(SourceKey.class);
        for (SourceKey key : SourceKey.values()) {
            String value = env.getProperty(PREFIX + key.property());
            if (value != null && !value.isBlank()) {
                overrides.put(key, value);
            }
        }
        SourceConfig config = SourceConfig.of(overrides);
        log.info("Upstream overrides in effect: {}", config);
        return config;
    }
}
