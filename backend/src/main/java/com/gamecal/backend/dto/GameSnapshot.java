package com.gamecal.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Events and current version of one game, taken together. {@code version} may be null. */
public record GameSnapshot(
        GameId game,
        List<CalendarEvent> events,
        GameVersionInfo version,
        @JsonProperty("events_updated_at") Instant eventsUpdatedAt
) {}
