package com.gamecal.backend.etl.zzz;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;
import com.gamecal.backend.etl.ContentCandidate;
import com.gamecal.backend.etl.ContentMatcher;
import com.gamecal.backend.etl.EventCollector;
import com.gamecal.backend.etl.GachaRules;
import com.gamecal.backend.etl.GamePipeline;
import com.gamecal.backend.etl.HtmlCleaner;
import com.gamecal.backend.etl.NoticeItem;
import com.gamecal.backend.etl.TimeRange;
import com.gamecal.backend.etl.TimeRangeExtractor;
import com.gamecal.backend.etl.VersionNoticeResolver;
import com.gamecal.backend.etl.VersionNoticeRule;
import com.gamecal.backend.etl.mihoyo.MihoyoActivityListResponse;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnContentResponse;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnListResponse;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnouncements;
import com.gamecal.backend.http.UpstreamFetcher;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple3;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Activities come from {@code getActivityList} with epoch-second bounds. Banners and bodies are
 * attached by fuzzy title match against {@code getAnnContent}. Gacha banners are not in the
 * activity list at all and are read from the content bodies instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZzzPipeline implements GamePipeline {

    private static final String QUERY =
            "?uid=11111111&game=nap&game_biz=nap_cn&lang=zh-cn&bundle_id=nap_cn&channel_id=1&level=60&platform=pc&region=prod_gf_cn";
    private static final String BASE = "https://announcement-api.mihoyo.com/common/nap_cn/announcement/api/";

    static final String DEFAULT_ACTIVITY_API = BASE + "getActivityList" + QUERY;
    static final String DEFAULT_LIST_API = BASE + "getAnnList" + QUERY;
    static final String DEFAULT_CONTENT_API = BASE + "getAnnContent" + QUERY;
    static final String SOURCE_OFFSET = "+08:00";

    private static final int NOTICE_CATEGORY = 3;
    private static final VersionNoticeRule VERSION_RULE =
            new VersionNoticeRule(List.of("版本更新说明", "版本更新公告"), List.of("维护预告"));

    private final UpstreamFetcher fetcher;
    private final MihoyoAnnouncements announcements;
    private final ContentMatcher contentMatcher;
    private final TimeRangeExtractor timeRangeExtractor;
    private final VersionNoticeResolver versionResolver;

    @Override
    public GameId game() {
        return GameId.ZZZ;
    }

    @Override
    public List<CalendarEvent> fetchEvents(SourceConfig config) {
        String activityUrl = config.getOrDefault(SourceKey.ZZZ_ACTIVITY_API_URL, DEFAULT_ACTIVITY_API);
        String contentUrl = config.getOrDefault(SourceKey.ZZZ_CONTENT_API_URL, DEFAULT_CONTENT_API);
        String listUrl = config.getOrDefault(SourceKey.ZZZ_API_URL, DEFAULT_LIST_API);

        Tuple3<MihoyoActivityListResponse, Optional<MihoyoAnnContentResponse>, Optional<MihoyoAnnListResponse>> fetched =
                Mono.zip(
                        fetcher.getJson(activityUrl, MihoyoActivityListResponse.class),
                        announcements.contentOrEmpty(contentUrl),
                        announcements.listOrEmpty(listUrl)
                ).block();

        // a fuzzy "opens after the update" gacha start falls back to the version notice start
        String fallbackStart = fetched.getT3()
                .flatMap(list -> versionResolver.currentNotice(noticeItems(list), VERSION_RULE))
                .map(n -> n.item().startIso())
                .orElse(null);

        List<MihoyoAnnContentResponse.ContentItem> contentItems =
                fetched.getT2().map(MihoyoAnnContentResponse::allItems).orElse(List.of());
        List<ContentCandidate> candidates = new ArrayList<>();
        for (MihoyoAnnContentResponse.ContentItem it : contentItems) {
            ContentCandidate c = ContentCandidate.of(it.title(), it.bannerOrImage(), it.content());
            if (!c.key().isEmpty()) candidates.add(c);
        }

        EventCollector collector = new EventCollector();
        List<MihoyoActivityListResponse.Activity> activities = fetched.getT1().activities();
        for (MihoyoActivityListResponse.Activity a : activities) {
            toEvent(a, candidates).ifPresent(collector::add);
        }
        int activityCount = collector.size();
        for (MihoyoAnnContentResponse.ContentItem it : contentItems) {
            toGachaEvent(it, fallbackStart).ifPresent(collector::add);
        }
        log.debug("zzz: {} activities, {} emitted from activities, {} total, {} content candidates",
                activities.size(), activityCount, collector.size(), candidates.size());
        return collector.sorted();
    }

    @Override
    public Optional<GameVersionInfo> fetchCurrentVersion(SourceConfig config) {
        String listUrl = config.getOrDefault(SourceKey.ZZZ_API_URL, DEFAULT_LIST_API);
        MihoyoAnnListResponse list = announcements.list(listUrl).block();
        return versionResolver.resolve(GameId.ZZZ, noticeItems(list), VERSION_RULE);
    }

    private Optional<CalendarEvent> toEvent(MihoyoActivityListResponse.Activity a, List<ContentCandidate> candidates) {
        if (isBlank(a.name()) || isBlank(a.startTime()) || isBlank(a.endTime())) return Optional.empty();
        Optional<Long> start = IsoTimes.parseEpochSeconds(a.startTime());
        Optional<Long> end = IsoTimes.parseEpochSeconds(a.endTime());
        if (start.isEmpty() || end.isEmpty() || end.get() <= start.get()) return Optional.empty();

        Optional<ContentCandidate> matched = contentMatcher.bestMatch(a.name(), candidates);
        return Optional.of(CalendarEvent.builder()
                .id(isBlank(a.activityId()) ? a.name() + ":" + a.startTime() : a.activityId())
                .title(a.name())
                .startTime(IsoTimes.unixSecondsToIsoWithOffset(start.get(), SOURCE_OFFSET))
                .endTime(IsoTimes.unixSecondsToIsoWithOffset(end.get(), SOURCE_OFFSET))
                .gacha(GachaRules.isGacha(GameId.ZZZ, a.name()))
                .banner(matched.map(ContentCandidate::banner).orElse(null))
                .content(matched.map(ContentCandidate::content).orElse(null))
                .build());
    }

    private Optional<CalendarEvent> toGachaEvent(MihoyoAnnContentResponse.ContentItem it, String fallbackStart) {
        String title = HtmlCleaner.toText(it.title());
        if (!GachaRules.isGacha(GameId.ZZZ, title)) return Optional.empty();

        TimeRange range = timeRangeExtractor.extract(it.content(), SOURCE_OFFSET);
        String start = range.startIso() != null ? range.startIso() : fallbackStart;
        if (start == null || range.endIso() == null) return Optional.empty();

        String discriminator = it.annId() != null ? String.valueOf(it.annId()) : ContentMatcher.matchKey(title);
        return Optional.of(CalendarEvent.builder()
                .id("zzz-gacha:" + discriminator)
                .title(title)
                .startTime(start)
                .endTime(range.endIso())
                .gacha(true)
                .banner(it.bannerOrImage())
                .content(it.content())
                .build());
    }

    private static List<NoticeItem> noticeItems(MihoyoAnnListResponse list) {
        List<MihoyoAnnListResponse.AnnItem> items = list.categoryById(NOTICE_CATEGORY)
                .or(() -> list.categoryByLabel("游戏公告"))
                .map(MihoyoAnnListResponse.Category::items)
                .orElse(List.of());
        return MihoyoAnnouncements.toNoticeItems(items, SOURCE_OFFSET);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
