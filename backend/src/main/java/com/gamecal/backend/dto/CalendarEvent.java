package com.gamecal.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * One limited-time activity. Times are ISO-8601 with an explicit offset and
 * {@code startTime} is always strictly before {@code endTime}.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalendarEvent(
        String id,
        String title,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("end_time") String endTime,
        @JsonProperty("is_gacha") boolean gacha,
        String banner,
        String content,
        @JsonProperty("link_url") String linkUrl
) {}
