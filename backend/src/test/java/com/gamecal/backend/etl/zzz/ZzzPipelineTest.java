package com.gamecal.backend.etl.zzz;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.etl.ContentMatcher;
import com.gamecal.backend.etl.TimeRangeExtractor;
import com.gamecal.backend.etl.VersionNoticeResolver;
import com.gamecal.backend.etl.mihoyo.MihoyoAnnouncements;
import com.gamecal.backend.exception.UpstreamStatusException;
import com.gamecal.backend.http.UpstreamFetcher;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZzzPipelineTest {

    private MockWebServer server;
    private ZzzPipeline pipeline;
    private SourceConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        UpstreamFetcher fetcher = Fixtures.fetcher();
        pipeline = new ZzzPipeline(fetcher, new MihoyoAnnouncements(fetcher), new ContentMatcher(),
                new TimeRangeExtractor(), new VersionNoticeResolver(MutableClock.at("2026-03-10T00:00:00Z")));
        config = SourceConfig.of(Map.of(
                SourceKey.ZZZ_ACTIVITY_API_URL, server.url("/zzz/activity").toString(),
                SourceKey.ZZZ_CONTENT_API_URL, server.url("/zzz/content").toString(),
                SourceKey.ZZZ_API_URL, server.url("/zzz/list").toString()));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void serve(MockResponse activity, MockResponse content, MockResponse list) {
        server.setDispatcher(Fixtures.routes(Map.of(
                "/zzz/activity", activity, "/zzz/content", content, "/zzz/list", list)));
    }

    @Test
    void mergesActivitiesWithGachaBannersFromContent() {
        serve(Fixtures.jsonFixture("zzz-activity-list.json"),
                Fixtures.jsonFixture("zzz-ann-content.json"),
                Fixtures.jsonFixture("zzz-ann-list.json"));

        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id)
                .containsExactly("「绳网挑战」:1772308800", "9001", "zzz-gacha:503", "zzz-gacha:504");

        CalendarEvent net = events.get(0);
        assertThat(net.startTime()).isEqualTo("2026-03-01T04:00:00+08:00");
        assertThat(net.endTime()).isEqualTo("2026-03-25T03:59:00+08:00");
        assertThat(net.banner()).isEqualTo("https://img.example/zzz-502.png");

        CalendarEvent hollow = events.get(1);
        assertThat(hollow.endTime()).isEqualTo("2026-03-10T10:00:00+08:00");
        assertThat(hollow.content()).isEqualTo("<p>空洞探险说明</p>");
        assertThat(hollow.gacha()).isFalse();
    }

    @Test
    void fuzzyGachaStartUsesTheCurrentVersionNotice() {
        serve(Fixtures.jsonFixture("zzz-activity-list.json"),
                Fixtures.jsonFixture("zzz-ann-content.json"),
                Fixtures.jsonFixture("zzz-ann-list.json"));

        CalendarEvent gacha = pipeline.fetchEvents(config).stream()
                .filter(e -> e.id().equals("zzz-gacha:503")).findFirst().orElseThrow();

        assertThat(gacha.gacha()).isTrue();
        assertThat(gacha.startTime()).isEqualTo("2026-03-05T06:00:00+08:00");
        assertThat(gacha.endTime()).isEqualTo("2026-03-24T11:59:00+08:00");
    }

    @Test
    void pictureEntriesUseTheirImageAsBanner() {
        serve(Fixtures.jsonFixture("zzz-activity-list.json"),
                Fixtures.jsonFixture("zzz-ann-content.json"),
                Fixtures.jsonFixture("zzz-ann-list.json"));

        CalendarEvent gacha = pipeline.fetchEvents(config).stream()
                .filter(e -> e.id().equals("zzz-gacha:504")).findFirst().orElseThrow();

        assertThat(gacha.banner()).isEqualTo("https://img.example/zzz-504.png");
        assertThat(gacha.startTime()).isEqualTo("2026-03-10T12:00:00+08:00");
    }

    @Test
    void withoutVersionNoticesFuzzyGachaIsDropped() {
        serve(Fixtures.jsonFixture("zzz-activity-list.json"),
                Fixtures.jsonFixture("zzz-ann-content.json"),
                Fixtures.status(503));

        assertThat(pipeline.fetchEvents(config)).extracting(CalendarEvent::id)
                .containsExactly("「绳网挑战」:1772308800", "9001", "zzz-gacha:504");
    }

    @Test
    void withoutContentActivitiesStillArrive() {
        serve(Fixtures.jsonFixture("zzz-activity-list.json"),
                Fixtures.status(500),
                Fixtures.jsonFixture("zzz-ann-list.json"));

        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("「绳网挑战」:1772308800", "9001");
        assertThat(events).allSatisfy(e -> assertThat(e.banner()).isNull());
    }

    @Test
    void activityWithUnrepresentableTimestampIsDroppedAlone() {
        serve(Fixtures.json("{\"retcode\":0,\"message\":\"OK\",\"data\":{\"activity_list\":["
                        + "{\"activity_id\":\"9001\",\"name\":\"「空洞探险」限时活动\","
                        + "\"start_time\":\"1772323200\",\"end_time\":\"1773108000\"},"
                        + "{\"activity_id\":\"9004\",\"name\":\"远古活动\","
                        + "\"start_time\":\"1e17\",\"end_time\":\"2e17\"}]}}"),
                Fixtures.status(500),
                Fixtures.status(503));

        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("9001");
        assertThat(events.get(0).startTime()).isEqualTo("2026-03-01T08:00:00+08:00");
    }

    @Test
    void activityFailureFailsTheGame() {
        serve(Fixtures.status(500),
                Fixtures.jsonFixture("zzz-ann-content.json"),
                Fixtures.jsonFixture("zzz-ann-list.json"));

        assertThatThrownBy(() -> pipeline.fetchEvents(config)).isInstanceOf(UpstreamStatusException.class);
    }

    @Test
    void versionFromGameNotices() {
        serve(Fixtures.jsonFixture("zzz-activity-list.json"),
                Fixtures.jsonFixture("zzz-ann-content.json"),
                Fixtures.jsonFixture("zzz-ann-list.json"));

        assertThat(pipeline.fetchCurrentVersion(config)).map(v -> v.version()).contains("2.0");
    }
}
