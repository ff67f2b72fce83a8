package com.gamecal.backend.etl.genshin;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;
import com.gamecal.backend.etl.VersionNoticeResolver;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnListResponse;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnouncements;
import com.gamecal.backend.exception.UpstreamStatusException;
import com.gamecal.backend.support.Fixtures;
import com.gamecal.backend.support.MutableClock;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenshinPipelineTest {

    private MockWebServer server;
    private GenshinPipeline pipeline;
    private SourceConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        MutableClock clock = MutableClock.at("2026-03-10T00:00:00Z");
        pipeline = new GenshinPipeline(new MihoyoAnnouncements(Fixtures.fetcher()), new VersionNoticeResolver(clock));
        config = SourceConfig.of(Map.of(
                SourceKey.GENSHIN_API_URL, server.url("/ann/list").toString(),
                SourceKey.GENSHIN_CONTENT_API_URL, server.url("/ann/content").toString()));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void serve(MockResponse list, MockResponse content) {
        server.setDispatcher(Fixtures.routes(Map.of("/ann/list", list, "/ann/content", content)));
    }

    @Test
    void emitsFilteredEventsInStartOrderWithContentEnrichment() {
        serve(Fixtures.jsonFixture("genshin-ann-list.json"), Fixtures.jsonFixture("genshin-ann-content.json"));

        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("1001", "1002");

        CalendarEvent wish = events.get(0);
        assertThat(wish.startTime()).isEqualTo("2026-03-01T06:00:00+08:00");
        assertThat(wish.endTime()).isEqualTo("2026-03-20T17:59:00+08:00");
        assertThat(wish.gacha()).isTrue();
        assertThat(wish.banner()).isEqualTo("https://img.example/list-1001.png");
        assertThat(wish.content()).isEqualTo("<p>祈愿详情</p>");

        CalendarEvent event = events.get(1);
        assertThat(event.gacha()).isFalse();
        assertThat(event.banner()).isEqualTo("https://img.example/content-1002.png");
        assertThat(event.content()).isEqualTo("<p>活动详情</p>");
    }

    @Test
    void contentFailureFallsBackToListFields() {
        serve(Fixtures.jsonFixture("genshin-ann-list.json"), Fixtures.status(502));

        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("1001", "1002");
        assertThat(events.get(1).banner()).isNull();
        assertThat(events.get(1).content()).isEqualTo("<p>列表摘要</p>");
    }

    @Test
    void listFailureFailsTheGame() {
        serve(Fixtures.status(500), Fixtures.jsonFixture("genshin-ann-content.json"));

        assertThatThrownBy(() -> pipeline.fetchEvents(config))
                .isInstanceOf(UpstreamStatusException.class)
                .satisfies(e -> assertThat(((UpstreamStatusException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void currentVersionComesFromTheActiveUpdateNotice() {
        serve(Fixtures.jsonFixture("genshin-ann-list.json"), Fixtures.jsonFixture("genshin-ann-content.json"));

        Optional<GameVersionInfo> version = pipeline.fetchCurrentVersion(config);

        assertThat(version).isPresent();
        assertThat(version.get().game()).isEqualTo(GameId.GENSHIN);
        assertThat(version.get().version()).isEqualTo("5.4");
        assertThat(version.get().annId()).isEqualTo(2001L);
        assertThat(version.get().startTime()).isEqualTo("2026-02-10T06:00:00+08:00");
    }

    @Test
    void keepRejectsDenylistedIdsAndWords() {
        assertThat(GenshinPipeline.keep(item(495L, "社区活动"))).isFalse();
        assertThat(GenshinPipeline.keep(item(7L, "问卷调研"))).isFalse();
        assertThat(GenshinPipeline.keep(item(7L, "「沙海游记」活动"))).isTrue();
    }

    private static MihoyoAnnListResponse.AnnItem item(long id, String title) {
        return new MihoyoAnnListResponse.AnnItem(
                id, title, null, null, null, "2026-03-01 06:00:00", "2026-03-10 06:00:00");
    }
}
