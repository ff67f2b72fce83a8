package com.gamecal.backend.etl.endfield;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.etl.TimeRangeExtractor;
import com.gamecal.backend.http.UpstreamFetcher;
import com.gamecal.backend.support.Fixtures;
import com.gamecal.backend.support.MutableClock;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EndfieldPipelineTest {

    private MockWebServer server;
    private EndfieldPipeline pipeline;
    private SourceConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        server.setDispatcher(Fixtures.routes(Map.of("/bulletin/aggregate", Fixtures.jsonFixture("endfield-aggregate.json"))));
        UpstreamFetcher fetcher = Fixtures.fetcher();
        pipeline = new EndfieldPipeline(fetcher,
                new EndfieldCodeResolver(fetcher, MutableClock.at("2026-03-10T00:00:00Z")),
                new TimeRangeExtractor());
        config = SourceConfig.of(Map.of(
                SourceKey.ENDFIELD_AGGREGATE_API_URL, server.url("/bulletin/aggregate?type=9").toString(),
                SourceKey.ENDFIELD_CODE, "endfield_TEST1"));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void keepsEventTabsWithAnEnd() {
        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("e2", "e1");
    }

    @Test
    void fuzzyStartFallsBackToPublishTime() {
        CalendarEvent recycle = pipeline.fetchEvents(config).get(0);

        assertThat(recycle.startTime()).isEqualTo("2026-03-01T08:00:00+08:00");
        assertThat(recycle.endTime()).isEqualTo("2026-03-20T04:00:00+08:00");
        assertThat(recycle.banner()).isNull();
    }

    @Test
    void titleEscapesAreFlattenedAndFirstImageIsTheBanner() {
        CalendarEvent pull = pipeline.fetchEvents(config).get(1);

        assertThat(pull.title()).isEqualTo("「特许寻访」开启 限时");
        assertThat(pull.gacha()).isTrue();
        assertThat(pull.startTime()).isEqualTo("2026-03-01T10:00:00+08:00");
        assertThat(pull.banner()).isEqualTo("https://img.example/ef-1.png");
        assertThat(pull.content()).contains("活动时间");
    }

    @Test
    void publishTimeOutsideTheCalendarRangeDropsOnlyThatItem() {
        String html = "{\"html\":\"<p>活动时间：公测开启后 - 2026/03/20 04:00</p>\"}";
        server.setDispatcher(Fixtures.routes(Map.of("/bulletin/aggregate", Fixtures.json(
                "{\"code\":0,\"msg\":\"\",\"data\":{\"list\":["
                        + "{\"cid\":\"e8\",\"tab\":\"events\",\"title\":\"远古活动\","
                        + "\"startAt\":100000000000000000,\"data\":" + html + "},"
                        + "{\"cid\":\"e9\",\"tab\":\"events\",\"title\":\"协议回收\","
                        + "\"startAt\":1772323200,\"data\":" + html + "}]}}"))));

        List<CalendarEvent> events = pipeline.fetchEvents(config);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("e9");
        assertThat(events.get(0).startTime()).isEqualTo("2026-03-01T08:00:00+08:00");
    }

    @Test
    void requestCarriesCodeAndReplacesQueryParameters() throws InterruptedException {
        pipeline.fetchEvents(config);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getRequestUrl().queryParameter("type")).isEqualTo("0");
        assertThat(request.getRequestUrl().queryParameter("code")).isEqualTo("endfield_TEST1");
        assertThat(request.getRequestUrl().queryParameter("hideDetail")).isEqualTo("0");
    }

    @Test
    void noVersionForThisGame() {
        assertThat(pipeline.fetchCurrentVersion(config)).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void normalizeTitleHandlesNull() {
        assertThat(EndfieldPipeline.normalizeTitle(null)).isEmpty();
        assertThat(EndfieldPipeline.normalizeTitle("a\\r\\nb\\tc")).isEqualTo("a b c");
    }
}
