package com.gamecal.backend.etl.snowbreak;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static announce config. {@code title} and {@code content} may be plain strings or
 * JSON-encoded maps of locale to text; times are epoch seconds sent as number or string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnowbreakAnnounceResponse(List<Item> announce) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            String id,
            String title,
            @JsonProperty("left_title") String leftTitle,
            String content,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime,
            Integer type
    ) {}

    public List<Item> items() {
        return announce == null ? List.of() : announce;
    }
}
