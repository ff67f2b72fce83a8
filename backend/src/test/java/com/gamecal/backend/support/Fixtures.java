package com.gamecal.backend.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamecal.backend.http.UpstreamFetcher;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class Fixtures {

    private Fixtures() {}

    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static MockResponse json(String body) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json; charset=utf-8")
                .setBody(body);
    }

    public static MockResponse jsonFixture(String name) {
        return json(read(name));
    }

    /** Answers by request path, ignoring the query; unknown paths get a 404. */
    public static Dispatcher routes(Map<String, MockResponse> byPath) {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getRequestUrl() == null ? "" : request.getRequestUrl().encodedPath();
                MockResponse response = byPath.get(path);
                return response != null ? response : new MockResponse().setResponseCode(404).setBody("not found");
            }
        };
    }

    public static MockResponse status(int code) {
        return new MockResponse().setResponseCode(code).setBody("error " + code);
    }

    public static UpstreamFetcher fetcher(long timeoutMs) {
        return new UpstreamFetcher(WebClient.builder().build(), MAPPER, timeoutMs, null);
    }

    public static UpstreamFetcher fetcher() {
        return fetcher(2_000);
    }
}
