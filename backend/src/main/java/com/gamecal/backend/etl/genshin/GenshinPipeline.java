package com.gamecal.backend.etl.genshin;

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
public class GenshinPipeline implements GamePipeline {

    static final String DEFAULT_LIST_API =
            "https://hk4e-api.mihoyo.com/common/hk4e_cn/announcement/api/getAnnList?game=hk4e&game_biz=hk4e_cn&lang=zh-cn&bundle_id=hk4e_cn&platform=pc&region=cn_gf01&level=55&uid=100000000";
    static final String DEFAULT_CONTENT_API =
            "https://hk4e-api.mihoyo.com/common/hk4e_cn/announcement/api/getAnnContent?game=hk4e&game_biz=hk4e_cn&lang=zh-cn&bundle_id=hk4e_cn&platform=pc&region=cn_gf01&level=55&uid=100000000";
    static final String SOURCE_OFFSET = "+08:00";

    private static final int EVENT_CATEGORY = 1;
    private static final int NOTICE_CATEGORY = 2;

    private static final Set<Long> IGNORE_ANN_IDS = Set.of(495L, 1263L, 423L, 422L, 762L, 20835L);
    private static final List<String> IGNORE_WORDS = List.of(
            "修复", "内容专题页", "米游社", "调研", "防沉迷", "问卷", "公平运营", "纪行", "有奖活动", "反馈功能");

    private static final VersionNoticeRule VERSION_RULE = new VersionNoticeRule(List.of("版本更新说明"), List.of());

    private final MihoyoAnnouncements announcements;
    private final VersionNoticeResolver versionResolver;

    @Override
    public GameId game() {
        return GameId.GENSHIN;
    }

    @Override
    public List<CalendarEvent> fetchEvents(SourceConfig config) {
        String listUrl = config.getOrDefault(SourceKey.GENSHIN_API_URL, DEFAULT_LIST_API);
        String contentUrl = config.getOrDefault(SourceKey.GENSHIN_CONTENT_API_URL, DEFAULT_CONTENT_API);

        Tuple2<MihoyoAnnListResponse, Optional<MihoyoAnnContentResponse>> fetched = Mono.zip(
                announcements.list(listUrl),
                announcements.contentOrEmpty(contentUrl)
        ).block();

        List<MihoyoAnnListResponse.AnnItem> items = fetched.getT1().categoryById(EVENT_CATEGORY)
                .map(MihoyoAnnListResponse.Category::items)
                .orElse(List.of());
        Map<Long, MihoyoAnnContentResponse.ContentItem> contentById =
                MihoyoAnnouncements.contentById(fetched.getT2());

        EventCollector collector = new EventCollector();
        for (MihoyoAnnListResponse.AnnItem item : items) {
            if (!keep(item)) continue;
            MihoyoAnnContentResponse.ContentItem detail = contentById.get(item.annId());
            collector.add(CalendarEvent.builder()
                    .id(String.valueOf(item.annId()))
                    .title(item.title())
                    .startTime(IsoTimes.toIsoWithOffset(item.startTime(), SOURCE_OFFSET))
                    .endTime(IsoTimes.toIsoWithOffset(item.endTime(), SOURCE_OFFSET))
                    .gacha(GachaRules.isGacha(GameId.GENSHIN, item.title()))
                    .banner(firstPresent(item.banner(), detail == null ? null : detail.banner()))
                    .content(firstPresent(detail == null ? null : detail.content(), item.content()))
                    .build());
        }
        log.debug("genshin: {} listed, {} emitted, {} content records", items.size(), collector.size(), contentById.size());
        return collector.sorted();
    }

    @Override
    public Optional<GameVersionInfo> fetchCurrentVersion(SourceConfig config) {
        String listUrl = config.getOrDefault(SourceKey.GENSHIN_API_URL, DEFAULT_LIST_API);
        MihoyoAnnListResponse list = announcements.list(listUrl).block();

        List<MihoyoAnnListResponse.AnnItem> notices = list.categoryById(NOTICE_CATEGORY)
                .or(() -> list.categoryByLabel("游戏公告"))
                .map(MihoyoAnnListResponse.Category::items)
                .orElse(List.of());
        return versionResolver.resolve(GameId.GENSHIN,
                MihoyoAnnouncements.toNoticeItems(notices, SOURCE_OFFSET), VERSION_RULE);
    }

    static boolean keep(MihoyoAnnListResponse.AnnItem item) {
        if (item.annId() == null || item.startTime() == null || item.endTime() == null) return false;
        if (IGNORE_ANN_IDS.contains(item.annId())) return false;
        String title = item.title() == null ? "" : item.title();
        return IGNORE_WORDS.stream().noneMatch(title::contains);
    }

    private static String firstPresent(String a, String b) {
        return a != null ? a : b;
    }
}
