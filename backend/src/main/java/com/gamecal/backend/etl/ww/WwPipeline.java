package com.gamecal.backend.etl.ww;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.etl.EventCollector;
import com.gamecal.backend.etl.GachaRules;
import com.gamecal.backend.etl.GamePipeline;
import com.gamecal.backend.etl.StableIds;
import com.gamecal.backend.http.UpstreamFetcher;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the "版本活动" module of the community wiki home page. The wiki has no version notices,
 * so the current version is always empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WwPipeline implements GamePipeline {

    static final String DEFAULT_HOME_API = "https://api.kurobbs.com/wiki/core/homepage/getPage";
    static final String DEFAULT_CATALOGUE_API = "https://api.kurobbs.com/wiki/core/catalogue/item/getPage";
    static final String SOURCE_OFFSET = "+08:00";

    private static final String WIKI_TYPE_HEADER = "Wiki_type";
    private static final String WIKI_TYPE = "9";
    private static final String TARGET_MODULE = "版本活动";

    private final UpstreamFetcher fetcher;

    @Override
    public GameId game() {
        return GameId.WW;
    }

    @Override
    public List<CalendarEvent> fetchEvents(SourceConfig config) {
        String homeUrl = config.getOrDefault(SourceKey.WW_WIKI_HOME_URL, DEFAULT_HOME_API);
        KuroWikiHomeResponse home = fetcher
                .postJson(homeUrl, Map.of(WIKI_TYPE_HEADER, WIKI_TYPE), KuroWikiHomeResponse.class)
                .block();

        KuroWikiHomeResponse.SideModule module = home.sideModules().stream()
                .filter(m -> TARGET_MODULE.equals(m.title()))
                .findFirst()
                .orElse(null);
        if (module == null) {
            log.debug("ww: no '{}' module on the wiki home page", TARGET_MODULE);
            return List.of();
        }

        Map<String, String> images = module.catalogueId() == null
                ? Map.of()
                : fetchImages(config, module.catalogueId());

        EventCollector collector = new EventCollector();
        for (KuroWikiHomeResponse.Entry entry : module.entries()) {
            if (entry == null || entry.countDown() == null) continue;
            List<String> range = entry.countDown().dateRange();
            if (range == null || range.size() < 2 || isBlank(range.get(0)) || isBlank(range.get(1))) continue;

            String title = entry.title() == null ? "" : entry.title();
            String start = range.get(0);
            String entryId = entry.linkConfig() == null ? null : entry.linkConfig().entryId();
            // one wiki entry can host several activities, so the title is part of the id
            String id = isBlank(entryId) ? StableIds.of(title, start) : StableIds.of(title, entryId);
            String banner = isBlank(entryId) ? null : images.get(entryId);

            collector.add(CalendarEvent.builder()
                    .id(id)
                    .title(title)
                    .startTime(IsoTimes.toIsoWithOffset(start, SOURCE_OFFSET))
                    .endTime(IsoTimes.toIsoWithOffset(range.get(1), SOURCE_OFFSET))
                    .gacha(GachaRules.isGacha(GameId.WW, title))
                    .banner(banner != null ? banner : entry.contentUrl())
                    .linkUrl(entry.linkConfig() == null ? null : entry.linkConfig().linkUrl())
                    .build());
        }
        log.debug("ww: {} entries, {} emitted, {} catalogue images", module.entries().size(), collector.size(), images.size());
        return collector.sorted();
    }

    private Map<String, String> fetchImages(SourceConfig config, long catalogueId) {
        String base = config.getOrDefault(SourceKey.WW_WIKI_CATALOGUE_URL, DEFAULT_CATALOGUE_API);
        String url = base + "?catalogueId=" + catalogueId + "&page=1&limit=1000";
        Map<String, String> headers = Map.of(
                WIKI_TYPE_HEADER, WIKI_TYPE,
                HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE);

        return fetcher.postJson(url, headers, KuroCatalogueResponse.class)
                .map(WwPipeline::imagesByEntryId)
                .onErrorResume(e -> {
                    log.warn("ww: catalogue {} unavailable: {}", url, e.getMessage());
                    return Mono.just(Map.of());
                })
                .block();
    }

    static Map<String, String> imagesByEntryId(KuroCatalogueResponse catalogue) {
        Map<String, String> out = new HashMap<>();
        for (KuroCatalogueResponse.Record r : catalogue.records()) {
            if (r == null || isBlank(r.entryId()) || r.content() == null || isBlank(r.content().contentUrl())) continue;
            out.put(r.entryId(), r.content().contentUrl());
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
