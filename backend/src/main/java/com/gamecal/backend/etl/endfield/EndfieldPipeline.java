package com.gamecal.backend.etl.endfield;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.etl.EventCollector;
import com.gamecal.backend.etl.GachaRules;
import com.gamecal.backend.etl.GamePipeline;
import com.gamecal.backend.etl.HtmlCleaner;
import com.gamecal.backend.etl.TimeRange;
import com.gamecal.backend.etl.TimeRangeExtractor;
import com.gamecal.backend.http.UpstreamFetcher;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Bulletin items carry no structured window, so the range is read from the HTML body. A fuzzy
 * start such as "公测开启后" falls back to the item's {@code startAt}; a missing end means a
 * permanent activity, which is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndfieldPipeline implements GamePipeline {

    static final String DEFAULT_AGGREGATE_API = "https://game-hub.hypergryph.com/bulletin/v2/aggregate";
    static final String SOURCE_OFFSET = "+08:00";

    private static final Set<String> EVENT_TABS = Set.of("events", "event");
    private static final Pattern ESCAPED_WHITESPACE = Pattern.compile("\\\\[rnt]");

    private final UpstreamFetcher fetcher;
    private final EndfieldCodeResolver codeResolver;
    private final TimeRangeExtractor timeRangeExtractor;

    @Override
    public GameId game() {
        return GameId.ENDFIELD;
    }

    @Override
    public List<CalendarEvent> fetchEvents(SourceConfig config) {
        String url = aggregateUrl(
                config.getOrDefault(SourceKey.ENDFIELD_AGGREGATE_API_URL, DEFAULT_AGGREGATE_API),
                codeResolver.resolve(config));
        HypergryphAggregateResponse res = fetcher.getJson(url, HypergryphAggregateResponse.class).block();

        EventCollector collector = new EventCollector();
        List<HypergryphAggregateResponse.Item> items = res.items();
        for (HypergryphAggregateResponse.Item it : items) {
            toEvent(it).ifPresent(collector::add);
        }
        log.debug("endfield: {} bulletin items, {} emitted", items.size(), collector.size());
        return collector.sorted();
    }

    static String aggregateUrl(String base, String code) {
        return UriComponentsBuilder.fromHttpUrl(base)
                .replaceQueryParam("type", "0")
                .replaceQueryParam("code", code)
                .replaceQueryParam("hideDetail", "0")
                .build()
                .toUriString();
    }

    private Optional<CalendarEvent> toEvent(HypergryphAggregateResponse.Item it) {
        String tab = it.tab() == null ? "" : it.tab().toLowerCase(Locale.ROOT);
        if (!EVENT_TABS.contains(tab)) return Optional.empty();
        String html = it.html();
        if (html == null || html.isEmpty()) return Optional.empty();

        TimeRange range = timeRangeExtractor.extract(html, SOURCE_OFFSET);
        if (range.endIso() == null) return Optional.empty();
        String start = range.startIso();
        if (start == null && it.startAt() != null && IsoTimes.isSupportedEpochSeconds(it.startAt())) {
            start = IsoTimes.unixSecondsToIsoWithOffset(it.startAt(), SOURCE_OFFSET);
        }
        if (start == null) return Optional.empty();

        String cleanTitle = normalizeTitle(it.title());
        String title = !cleanTitle.isEmpty() ? cleanTitle : (it.cid() != null && !it.cid().isEmpty() ? it.cid() : "活动");
        String id = it.cid() != null
                ? it.cid()
                : cleanTitle + ":" + (it.startAt() != null ? String.valueOf(it.startAt()) : start);

        return Optional.of(CalendarEvent.builder()
                .id(id)
                .title(title)
                .startTime(start)
                .endTime(range.endIso())
                .gacha(GachaRules.isGacha(GameId.ENDFIELD, title))
                .banner(HtmlCleaner.firstImageSrc(html))
                .content(html)
                .build());
    }

    /** Titles sometimes contain literal {@code \n} escape sequences. */
    static String normalizeTitle(String raw) {
        if (raw == null) return "";
        return HtmlCleaner.collapse(ESCAPED_WHITESPACE.matcher(raw).replaceAll(" "));
    }
}
