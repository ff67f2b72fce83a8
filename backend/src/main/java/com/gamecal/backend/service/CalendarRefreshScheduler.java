package com.gamecal.backend.service;

import com.gamecal.backend.dto.GameId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/** Keeps every game's events warm. One game failing never stops the others. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.refresh", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CalendarRefreshScheduler {

    private final GameCalendarService calendarService;

    @Scheduled(cron = "${app.refresh.cron:0 15 */8 * * *}", zone = "${app.refresh.zone:Asia/Shanghai}")
    public void refreshAll() {
        List<GameId> games = calendarService.listGames();
        log.info("Refreshing events for {} games", games.size());

        List<GameId> refreshed = Flux.fromIterable(games)
                .flatMap(game -> Mono.fromCallable(() -> calendarService.getEvents(game).size())
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnNext(count -> log.info("{}: {} events", game.wireId(), count))
                        .map(count -> game)
                        .onErrorResume(e -> {
                            log.error("Refresh failed for {}", game.wireId(), e);
                            return Mono.empty();
                        }))
                .collectList()
                .block();

        log.info("Refresh finished: {}/{} games ok", refreshed == null ? 0 : refreshed.size(), games.size());
    }
}
