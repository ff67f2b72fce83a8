package com.gamecal.backend.etl;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;

import java.util.List;
import java.util.Optional;

/** Fetch, filter, extract, enrich, dedupe and sort the activities of one publisher. */
public interface GamePipeline {

    GameId game();

    /** Fails only when the primary endpoint fails or times out. */
    List<CalendarEvent> fetchEvents(SourceConfig config);

    /** Empty when no version notice qualifies or none carries a label. */
    default Optional<GameVersionInfo> fetchCurrentVersion(SourceConfig config) {
        return Optional.empty();
    }
}
