package com.gamecal.backend.etl.starrail;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;
import com.gamecal.backend.etl.EventCollector;
import com.gamecal.backend.etl.GachaRules;
import com.gamecal.backend.etl.GamePipeline;
import com.gamecal.backend.etl.VersionNoticeResolver;
import com.gamecal.backend.etl.VersionNoticeRule;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnContentResponse;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnListResponse;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnouncements;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class StarRailPipeline implements GamePipeline {

    static final String DEFAULT_LIST_API =
            "https://hkrpg-api-static.mihoyo.com/common/hkrpg_cn/announcement/api/getAnnList?game=hkrpg&game_biz=hkrpg_cn&lang=zh-cn&bundle_id=hkrpg_cn&platform=pc&region=prod_gf_cn&level=30&uid=11111111";
    static final String DEFAULT_CONTENT_API =
            "https://hkrpg-api-static.mihoyo.com/common/hkrpg_cn/announcement/api/getAnnContent?game=hkrpg&game_biz=hkrpg_cn&lang=zh-cn&bundle_id=hkrpg_cn&platform=pc&region=prod_gf_cn&level=30&uid=11111111";
    static final String SOURCE_OFFSET = "+08:00";

    private static final int EVENT_CATEGORY = 4;

    private static final Set<Long> IGNORE_ANN_IDS = Set.of(194L, 183L, 171L, 187L, 185L, 203L, 505L);
    private static final List<String> IGNORE_WORDS = List.of(
            "绘画征集", "内容专题页", "调研", "防沉迷", "米游社", "专项意见", "问卷调查", "版本更新通知",
            "预下载功能", "周边限时", "周边上新", "角色演示", "上新", "同行任务", "无名勋礼", "工具更新",
            "激励计划", "攻略征集", "更新概览", "有奖问卷");
    // "...活动说明" would otherwise fall to the "说明" suffix rule
    private static final List<String> INCLUDE_WORDS = List.of("活动说明");
    private static final List<String> IGNORE_SUFFIXES = List.of("说明");

    private static final VersionNoticeRule VERSION_RULE =
            new VersionNoticeRule(List.of("版本更新说明", "版本更新公告"), List.of("维护预告"));

    private final MihoyoAnnouncements announcements;
    private final VersionNoticeResolver versionResolver;

    @Override
    public GameId game() {
        return GameId.STARRAIL;
    }

    @Override
    public List<CalendarEvent> fetchEvents(SourceConfig config) {
        String listUrl = config.getOrDefault(SourceKey.STARRAIL_API_URL, DEFAULT_LIST_API);
        String contentUrl = config.getOrDefault(SourceKey.STARRAIL_CONTENT_API_URL, DEFAULT_CONTENT_API);

        Tuple2<MihoyoAnnListResponse, Optional<MihoyoAnnContentResponse>> fetched = Mono.zip(
                announcements.list(listUrl),
                announcements.contentOrEmpty(contentUrl)
        ).block();

        MihoyoAnnListResponse list = fetched.getT1();
        List<MihoyoAnnListResponse.AnnItem> items = list.categoryById(EVENT_CATEGORY)
                .or(() -> list.categories().stream().findFirst())
                .map(MihoyoAnnListResponse.Category::items)
                .orElse(List.of());
        Map<Long, MihoyoAnnContentResponse.ContentItem> contentById =
                MihoyoAnnouncements.contentById(fetched.getT2());

        EventCollector collector = new EventCollector();
        for (MihoyoAnnListResponse.AnnItem item : items) {
            if (!keep(item)) continue;
            String title = item.title() == null ? "" : item.title();
            MihoyoAnnContentResponse.ContentItem detail = contentById.get(item.annId());
            collector.add(CalendarEvent.builder()
                    .id(String.valueOf(item.annId()))
                    .title(title)
                    .startTime(IsoTimes.toIsoWithOffset(item.startTime(), SOURCE_OFFSET))
                    .endTime(IsoTimes.toIsoWithOffset(item.endTime(), SOURCE_OFFSET))
                    .gacha(GachaRules.isGacha(GameId.STARRAIL, title))
                    .banner(item.banner() != null ? item.banner() : detail == null ? null : detail.banner())
                    .content(detail != null && detail.content() != null ? detail.content() : item.content())
                    .build());
        }
        log.debug("starrail: {} listed, {} emitted", items.size(), collector.size());
        return collector.sorted();
    }

    @Override
    public Optional<GameVersionInfo> fetchCurrentVersion(SourceConfig config) {
        String listUrl = config.getOrDefault(SourceKey.STARRAIL_API_URL, DEFAULT_LIST_API);
        MihoyoAnnListResponse list = announcements.list(listUrl).block();

        List<MihoyoAnnListResponse.AnnItem> notices = list.categoryById(EVENT_CATEGORY)
                .or(() -> list.categoryByLabel("公告"))
                .map(MihoyoAnnListResponse.Category::items)
                .orElse(List.of());
        return versionResolver.resolve(GameId.STARRAIL,
                MihoyoAnnouncements.toNoticeItems(notices, SOURCE_OFFSET), VERSION_RULE);
    }

    /** Gacha titles always survive; then id denylist, title allowlist, word and suffix denylists. */
    static boolean keep(MihoyoAnnListResponse.AnnItem item) {
        if (item.annId() == null || item.startTime() == null || item.endTime() == null) return false;
        String title = item.title() == null ? "" : item.title();
        if (GachaRules.isGacha(GameId.STARRAIL, title)) return true;
        if (IGNORE_ANN_IDS.contains(item.annId())) return false;
        if (INCLUDE_WORDS.stream().anyMatch(title::contains)) return true;
        if (IGNORE_WORDS.stream().anyMatch(title::contains)) return false;
        return IGNORE_SUFFIXES.stream().noneMatch(title::endsWith);
    }
}
