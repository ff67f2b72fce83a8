package com.gamecal.backend.service;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;
import com.gamecal.backend.etl.GamePipeline;
import com.gamecal.backend.etl.endfield.EndfieldPipeline;
import com.gamecal.backend.etl.genshin.GenshinPipeline;
import com.gamecal.backend.etl.snowbreak.SnowbreakPipeline;
import com.gamecal.backend.etl.starrail.StarRailPipeline;
import com.gamecal.backend.etl.ww.WwPipeline;
import com.gamecal.backend.etl.zzz.ZzzPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/** Routes a game id to its pipeline. Uncached; see {@link GameCalendarService}. */
@Service
@RequiredArgsConstructor
public class GameEventService {

    private final GenshinPipeline genshin;
    private final StarRailPipeline starRail;
    private final WwPipeline ww;
    private final ZzzPipeline zzz;
    private final SnowbreakPipeline snowbreak;
    private final EndfieldPipeline endfield;

    public List<CalendarEvent> fetchEventsForGame(GameId game, SourceConfig config) {
        return pipelineFor(game).fetchEvents(config);
    }

    public Optional<GameVersionInfo> fetchCurrentVersionForGame(GameId game, SourceConfig config) {
        return pipelineFor(game).fetchCurrentVersion(config);
    }

    GamePipeline pipelineFor(GameId game) {
        return switch (game) {
            case GENSHIN -> genshin;
            case STARRAIL -> starRail;
            case WW -> ww;
            case ZZZ -> zzz;
            case SNOWBREAK -> snowbreak;
            case ENDFIELD -> endfield;
        };
    }
}
