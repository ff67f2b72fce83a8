package com.gamecal.backend.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamecal.backend.exception.UpstreamException;
import com.gamecal.backend.exception.UpstreamStatusException;
import com.gamecal.backend.exception.UpstreamTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Outbound calls to publisher endpoints with a hard timeout and one error taxonomy:
 * non-2xx becomes {@link UpstreamStatusException}, an expired timer cancels the exchange and
 * becomes {@link UpstreamTimeoutException}, anything else on the wire is an {@link UpstreamException}.
 */
@Slf4j
@Component
public class UpstreamFetcher {

    public static final String DEFAULT_USER_AGENT = "game-cal/0.0.1 (+https://github.com/)";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final String userAgent;

    public UpstreamFetcher(
            WebClient upstreamWebClient,
            ObjectMapper objectMapper,
            @Value("${app.http.timeout-ms:12000}") long timeoutMs,
            @Value("${app.http.user-agent:" + DEFAULT_USER_AGENT + "}") String userAgent
    ) {
        this.webClient = upstreamWebClient;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofMillis(timeoutMs > 0 ? timeoutMs : 12_000);
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent;
    }

    public <T> Mono<T> getJson(String url, Class<T> type) {
        return getText(url).map(body -> decode(url, body, type));
    }

    public <T> Mono<T> postJson(String url, Map<String, String> headers, Class<T> type) {
        return exchange(HttpMethod.POST, url, headers).map(body -> decode(url, body, type));
    }

    public Mono<String> getText(String url) {
        return exchange(HttpMethod.GET, url, Map.of());
    }

    public Duration getTimeout() {
        return timeout;
    }

    private Mono<String> exchange(HttpMethod method, String url, Map<String, String> headers) {
        return Mono.defer(() -> webClient.method(method)
                .uri(URI.create(url))
                .headers(h -> {
                    if (headers != null) {
                        headers.forEach((k, v) -> {
                            if (k != null && v != null) h.set(k, v);
                        });
                    }
                    if (!h.containsKey(HttpHeaders.USER_AGENT)) {
                        h.set(HttpHeaders.USER_AGENT, userAgent);
                    }
                })
                .retrieve()
                .onStatus(s -> !s.is2xxSuccessful(),
                        resp -> resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new UpstreamStatusException(url, resp.statusCode().value(), body)))
                .bodyToMono(String.class))
                .defaultIfEmpty("")
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new UpstreamTimeoutException(url, timeout, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new UpstreamException("Upstream request failed: " + safeMsg(e), url, e))
                .doOnError(e -> log.debug("upstream {} {} failed: {}", method, url, e.getMessage()));
    }

    private <T> T decode(String url, String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed upstream payload: " + safeMsg(e), url, "UPSTREAM_DECODE", e);
        }
    }

    private static String safeMsg(Exception e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }
}
