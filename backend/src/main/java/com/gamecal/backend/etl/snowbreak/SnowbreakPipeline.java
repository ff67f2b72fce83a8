package com.gamecal.backend.etl.snowbreak;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;
import com.gamecal.backend.etl.EventCollector;
import com.gamecal.backend.etl.GachaRules;
import com.gamecal.backend.etl.GamePipeline;
import com.gamecal.backend.etl.HtmlCleaner;
import com.gamecal.backend.etl.NoticeItem;
import com.gamecal.backend.etl.StableIds;
import com.gamecal.backend.etl.VersionNoticeResolver;
import com.gamecal.backend.etl.VersionNoticeRule;
import com.gamecal.backend.http.UpstreamFetcher;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All limited-time activities of one patch are described inside a single "限时活动公告".
 * The newest such notice is split into blocks and each dated line becomes an event; the
 * notice itself is emitted as one more event spanning its own window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnowbreakPipeline implements GamePipeline {

    static final String DEFAULT_ANNOUNCE_API =
            "https://cbjq-content.xoyocdn.com/ob202307/webfile/mainland/announce/config/pc_jinshan-pc_jinshan.json";
    static final String SOURCE_OFFSET = "+08:00";

    private static final String TARGET_SUFFIX = "限时活动公告";
    private static final List<String> LOCALE_KEYS = List.of("default", "zh-cn", "zh_cn", "zh", "cn");
    private static final DateTimeFormatter NAIVE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<String> INCLUDE_WORDS = List.of(
            "玩法", "关卡", "任务", "活动商店", "活动开启", "限时活动", "主线", "挑战", "联机", "签到活动");
    // banners, skins and shop items are not calendar activities
    private static final List<String> EXCLUDE_WORDS = List.of(
            "角色共鸣", "武器共鸣", "定向共鸣", "共鸣限时开放", "时装", "武器外观", "限时上架",
            "特别物资补给", "凭证", "复刻", "入队", "共鸣活动");

    private static final VersionNoticeRule VERSION_RULE =
            new VersionNoticeRule(List.of("版本更新公告", "版本更新说明"), List.of("维护预告"));

    private final UpstreamFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final VersionNoticeResolver versionResolver;
    private final Clock clock;

    @Override
    public GameId game() {
        return GameId.SNOWBREAK;
    }

    @Override
    public List<CalendarEvent> fetchEvents(SourceConfig config) {
        List<SnowbreakAnnounceResponse.Item> items = fetchAnnouncements(config);

        Optional<SnowbreakAnnounceResponse.Item> target = items.stream()
                .filter(it -> HtmlCleaner.collapse(localizedText(it.title())).endsWith(TARGET_SUFFIX))
                .max(Comparator.comparingLong(
                        (SnowbreakAnnounceResponse.Item it) -> IsoTimes.parseEpochSeconds(it.startTime()).orElse(0L)));
        if (target.isEmpty()) {
            log.debug("snowbreak: no '{}' among {} announcements", TARGET_SUFFIX, items.size());
            return List.of();
        }

        SnowbreakAnnounceResponse.Item notice = target.get();
        String html = localizedText(notice.content());
        if (html.isEmpty()) return List.of();

        EventCollector collector = new EventCollector();
        List<SnowbreakNoticeParser.Block> blocks =
                SnowbreakNoticeParser.parseBlocks(SnowbreakNoticeParser.tokenize(html));
        LocalDate anchor = anchorDate(notice);
        for (SnowbreakNoticeParser.Block block : blocks) {
            collector.addAll(blockEvents(block, anchor));
        }
        announcementEvent(notice, html).ifPresent(collector::add);

        log.debug("snowbreak: {} blocks, {} emitted", blocks.size(), collector.size());
        return collector.sorted();
    }

    @Override
    public Optional<GameVersionInfo> fetchCurrentVersion(SourceConfig config) {
        List<NoticeItem> notices = new ArrayList<>();
        for (SnowbreakAnnounceResponse.Item it : fetchAnnouncements(config)) {
            Optional<Long> start = IsoTimes.parseEpochSeconds(it.startTime());
            Optional<Long> end = IsoTimes.parseEpochSeconds(it.endTime());
            if (start.isEmpty() || end.isEmpty()) continue;
            notices.add(new NoticeItem(
                    IsoTimes.parseEpochSeconds(it.id()).orElse(null),
                    localizedText(it.title()),
                    localizedText(it.leftTitle()),
                    IsoTimes.unixSecondsToIsoWithOffset(start.get(), SOURCE_OFFSET),
                    IsoTimes.unixSecondsToIsoWithOffset(end.get(), SOURCE_OFFSET)));
        }
        return versionResolver.resolve(GameId.SNOWBREAK, notices, VERSION_RULE);
    }

    List<CalendarEvent> blockEvents(SnowbreakNoticeParser.Block block, LocalDate anchor) {
        List<CalendarEvent> out = new ArrayList<>();
        String content = SnowbreakNoticeParser.blockContent(block);
        for (String line : block.lines()) {
            SnowbreakNoticeParser.TimeLine timeLine = SnowbreakNoticeParser.parseTimeLine(line);
            if (timeLine == null) continue;

            LocalDateTime start = SnowbreakNoticeParser.parseDatePoint(timeLine.startRaw(), anchor);
            LocalDateTime end = SnowbreakNoticeParser.parseDatePoint(timeLine.endRaw(), anchor);
            if (start == null || end == null || !end.isAfter(start)) continue;

            String title = SnowbreakNoticeParser.buildEventTitle(block.title(), timeLine.prefix());
            if (!isWantedTitle(title)) continue;

            String startIso = IsoTimes.toIsoWithOffset(start.format(NAIVE), SOURCE_OFFSET);
            String endIso = IsoTimes.toIsoWithOffset(end.format(NAIVE), SOURCE_OFFSET);
            out.add(CalendarEvent.builder()
                    .id(StableIds.of(title, startIso, endIso))
                    .title(title)
                    .startTime(startIso)
                    .endTime(endIso)
                    .gacha(GachaRules.isGacha(GameId.SNOWBREAK, title))
                    .banner(block.banner())
                    .content(content)
                    .build());
        }
        return out;
    }

    static boolean isWantedTitle(String title) {
        if (title == null || title.isEmpty()) return false;
        if (EXCLUDE_WORDS.stream().anyMatch(title::contains)) return false;
        return INCLUDE_WORDS.stream().anyMatch(title::contains);
    }

    /**
     * Text of a field that is either plain or a JSON object keyed by locale. Preferred locales
     * are tried first, then any non-blank value.
     */
    String localizedText(String raw) {
        String s = raw == null ? "" : raw.trim();
        if (!s.startsWith("{")) return s;

        JsonNode node;
        try {
            node = objectMapper.readTree(s);
        } catch (JsonProcessingException e) {
            // a body that merely starts with a brace
            return s;
        }
        if (!node.isObject()) return s;

        for (String key : LOCALE_KEYS) {
            JsonNode v = node.get(key);
            if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText().trim();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            JsonNode v = fields.next().getValue();
            if (v.isTextual() && !v.asText().isBlank()) return v.asText().trim();
        }
        return s;
    }

    private List<SnowbreakAnnounceResponse.Item> fetchAnnouncements(SourceConfig config) {
        String url = config.getOrDefault(SourceKey.SNOWBREAK_ANNOUNCE_API_URL, DEFAULT_ANNOUNCE_API);
        return fetcher.getJson(url, SnowbreakAnnounceResponse.class).block().items();
    }

    /** Wall-clock date of the notice's end (else start, else today) in the source offset. */
    private LocalDate anchorDate(SnowbreakAnnounceResponse.Item notice) {
        long seconds = IsoTimes.parseEpochSeconds(notice.endTime()).filter(v -> v > 0)
                .or(() -> IsoTimes.parseEpochSeconds(notice.startTime()).filter(v -> v > 0))
                .orElseGet(() -> clock.instant().getEpochSecond());
        return Instant.ofEpochSecond(seconds).atOffset(ZoneOffset.of(SOURCE_OFFSET)).toLocalDate();
    }

    private Optional<CalendarEvent> announcementEvent(SnowbreakAnnounceResponse.Item notice, String html) {
        Optional<Long> start = IsoTimes.parseEpochSeconds(notice.startTime());
        Optional<Long> end = IsoTimes.parseEpochSeconds(notice.endTime());
        if (start.isEmpty() || end.isEmpty() || end.get() <= start.get()) return Optional.empty();

        String title = HtmlCleaner.collapse(localizedText(notice.title()));
        String key = notice.id() != null && !notice.id().isBlank()
                ? notice.id()
                : start.get() + ":" + end.get();
        return Optional.of(CalendarEvent.builder()
                .id("snowbreak-ann:" + key)
                .title(title.isEmpty() ? TARGET_SUFFIX : title)
                .startTime(IsoTimes.unixSecondsToIsoWithOffset(start.get(), SOURCE_OFFSET))
                .endTime(IsoTimes.unixSecondsToIsoWithOffset(end.get(), SOURCE_OFFSET))
                .banner(HtmlCleaner.firstImageSrc(html))
                .content(html)
                .build());
    }
}
