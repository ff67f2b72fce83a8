package com.gamecal.backend.service;

import com.gamecal.backend.cache.CoalescingTtlCache;
import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameSnapshot;
import com.gamecal.backend.dto.GameVersionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Cached view of the pipelines. Entries live for {@code app.cache.ttl-seconds}; a failed
 * refresh is surfaced to the caller and nothing stale is served.
 */
@Slf4j
@Service
public class GameCalendarService {

    static final long DEFAULT_TTL_SECONDS = 24 * 60 * 60;

    private record TimedEvents(List<CalendarEvent> events, Instant updatedAt) {}

    private final GameEventService gameEventService;
    private final CoalescingTtlCache cache;
    private final SourceConfig sourceConfig;
    private final Clock clock;
    private final Duration ttl;

    public GameCalendarService(
            GameEventService gameEventService,
            CoalescingTtlCache cache,
            SourceConfig sourceConfig,
            Clock clock,
            @Value("${app.cache.ttl-seconds:86400}") long ttlSeconds
    ) {
        this.gameEventService = gameEventService;
        this.cache = cache;
        this.sourceConfig = sourceConfig;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds > 0 ? ttlSeconds : DEFAULT_TTL_SECONDS);
    }

    public List<GameId> listGames() {
        return Arrays.asList(GameId.values());
    }

    public List<CalendarEvent> getEvents(GameId game) {
        return timedEvents(game).events();
    }

    public Optional<GameVersionInfo> getCurrentVersion(GameId game) {
        return cache.getOrSet("version:" + game.wireId(), ttl,
                () -> gameEventService.fetchCurrentVersionForGame(game, sourceConfig));
    }

    /** Events and current version fetched side by side; either failing fails the snapshot. */
    public GameSnapshot getSnapshot(GameId game) {
        return cache.getOrSet("snapshot:" + game.wireId(), ttl, () -> {
            Tuple2<TimedEvents, Optional<GameVersionInfo>> both = Mono.zip(
                    Mono.fromCallable(() -> timedEvents(game)).subscribeOn(Schedulers.boundedElastic()),
                    Mono.fromCallable(() -> getCurrentVersion(game)).subscribeOn(Schedulers.boundedElastic())
            ).block();
            TimedEvents events = both.getT1();
            return new GameSnapshot(game, events.events(), both.getT2().orElse(null), events.updatedAt());
        });
    }

    public Duration getTtl() {
        return ttl;
    }

    private TimedEvents timedEvents(GameId game) {
        return cache.getOrSet("events:" + game.wireId(), ttl, () -> {
            List<CalendarEvent> events = gameEventService.fetchEventsForGame(game, sourceConfig);
            log.debug("{}: fetched {} events", game.wireId(), events.size());
            return new TimedEvents(events, clock.instant());
        });
    }
}
