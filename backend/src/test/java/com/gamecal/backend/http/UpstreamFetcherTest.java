package com.gamecal.backend.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gamecal.backend.exception.UpstreamException;
import com.gamecal.backend.exception.UpstreamStatusException;
import com.gamecal.backend.exception.UpstreamTimeoutException;
import com.gamecal.backend.support.Fixtures;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamFetcherTest {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Payload(int retcode, String message) {}

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    @Test
    void decodesJsonAndSendsDefaultUserAgent() throws InterruptedException {
        server.enqueue(Fixtures.json("{\"retcode\":0,\"message\":\"OK\",\"extra\":1}"));
        UpstreamFetcher fetcher = Fixtures.fetcher();

        StepVerifier.create(fetcher.getJson(url("/list"), Payload.class))
                .assertNext(p -> {
                    assertThat(p.retcode()).isZero();
                    assertThat(p.message()).isEqualTo("OK");
                })
                .verifyComplete();

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req.getMethod()).isEqualTo("GET");
        assertThat(req.getHeader("User-Agent")).isEqualTo(UpstreamFetcher.DEFAULT_USER_AGENT);
    }

    @Test
    void postKeepsCallerHeaders() throws InterruptedException {
        server.enqueue(Fixtures.json("{\"retcode\":0,\"message\":\"OK\"}"));
        UpstreamFetcher fetcher = Fixtures.fetcher();

        fetcher.postJson(url("/wiki"), Map.of("Wiki_type", "9", "User-Agent", "custom/1"), Payload.class).block();

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getHeader("Wiki_type")).isEqualTo("9");
        assertThat(req.getHeader("User-Agent")).isEqualTo("custom/1");
    }

    @Test
    void nonSuccessStatusCarriesUrlStatusAndTruncatedBody() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("x".repeat(500)));
        UpstreamFetcher fetcher = Fixtures.fetcher();
        String target = url("/down");

        StepVerifier.create(fetcher.getText(target))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamStatusException.class);
                    UpstreamStatusException s = (UpstreamStatusException) e;
                    assertThat(s.getStatusCode()).isEqualTo(503);
                    assertThat(s.getUrl()).isEqualTo(target);
                    assertThat(s.getBodySnippet()).hasSize(200);
                    assertThat(s.getErrorCode()).isEqualTo("UPSTREAM_STATUS");
                })
                .verify();
    }

    @Test
    void redirectIsANonSuccessStatus() {
        server.enqueue(new MockResponse().setResponseCode(302).setBody("moved"));
        UpstreamFetcher fetcher = Fixtures.fetcher();

        StepVerifier.create(fetcher.getJson(url("/moved"), Payload.class))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamStatusException.class);
                    assertThat(((UpstreamStatusException) e).getStatusCode()).isEqualTo(302);
                    assertThat(((UpstreamStatusException) e).getBodySnippet()).isEqualTo("moved");
                })
                .verify();
    }

    @Test
    void slowUpstreamTimesOut() {
        server.enqueue(Fixtures.json("{}").setBodyDelay(2, TimeUnit.SECONDS));
        UpstreamFetcher fetcher = Fixtures.fetcher(200);

        StepVerifier.create(fetcher.getText(url("/slow")))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamTimeoutException.class);
                    assertThat(((UpstreamTimeoutException) e).getErrorCode()).isEqualTo("UPSTREAM_TIMEOUT");
                })
                .verify();
    }

    @Test
    void malformedJsonIsAnUpstreamError() {
        server.enqueue(Fixtures.json("<html>maintenance</html>"));
        UpstreamFetcher fetcher = Fixtures.fetcher();

        StepVerifier.create(fetcher.getJson(url("/list"), Payload.class))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamException.class);
                    assertThat(((UpstreamException) e).getErrorCode()).isEqualTo("UPSTREAM_DECODE");
                })
                .verify();
    }

    @Test
    void connectionRefusedIsAnUpstreamError() throws IOException {
        String target = url("/gone");
        server.shutdown();
        UpstreamFetcher fetcher = Fixtures.fetcher();

        StepVerifier.create(fetcher.getText(target))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamException.class);
                    assertThat(((UpstreamException) e).getErrorCode()).isEqualTo("UPSTREAM_IO");
                })
                .verify();
    }
}
