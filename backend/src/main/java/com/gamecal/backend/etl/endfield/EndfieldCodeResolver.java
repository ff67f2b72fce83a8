package com.gamecal.backend.etl.endfield;

import com.gamecal.backend.config.SourceConfig;
import com.gamecal.backend.config.SourceKey;
import com.gamecal.backend.http.UpstreamFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the bulletin {@code code} query parameter, which the publisher rotates. Resolution order:
 * configured override, a value discovered within the last six hours, fresh discovery from the
 * webview bundle, and finally a last-known-good constant. Discovery never fails the caller.
 */
@Slf4j
@Component
public class EndfieldCodeResolver {

    static final String DEFAULT_WEBVIEW_URL = "https://ef-webview.hypergryph.com/page/game_bulletin?target=IOS";
    static final String FALLBACK_CODE = "endfield_5SD9TN";
    static final Duration CODE_TTL = Duration.ofHours(6);

    private static final Pattern COMMONS_SCRIPT_TAG =
            Pattern.compile("<script[^>]+src=\"([^\"]+/commons\\.[^\"]+\\.js)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMONS_ABSOLUTE_URL =
            Pattern.compile("https?://[^\\s\"'<>]+/commons\\.[^\\s\"'<>]+\\.js", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIRECT_CODE = Pattern.compile("\"code\",\"(endfield_[A-Za-z0-9]+)\"");
    private static final Pattern ANY_CODE = Pattern.compile("endfield_[A-Za-z0-9]+");
    private static final String PREFIX = "endfield_";
    private static final String NOT_A_CODE = "endfield_webview";

    private record CachedCode(String value, Instant expiresAt) {}

    private final UpstreamFetcher fetcher;
    private final Clock clock;
    private final AtomicReference<CachedCode> cached = new AtomicReference<>();

    public EndfieldCodeResolver(UpstreamFetcher fetcher, Clock clock) {
        this.fetcher = fetcher;
        this.clock = clock;
    }

    public String resolve(SourceConfig config) {
        Optional<String> override = config.get(SourceKey.ENDFIELD_CODE);
        if (override.isPresent()) return override.get();

        CachedCode hit = cached.get();
        if (hit != null && clock.instant().isBefore(hit.expiresAt())) return hit.value();

        String webviewUrl = config.getOrDefault(SourceKey.ENDFIELD_WEBVIEW_URL, DEFAULT_WEBVIEW_URL);
        DiscoveryResult result = discover(webviewUrl).block();
        if (result != null && result.isSuccess()) {
            cached.set(new CachedCode(result.value(), clock.instant().plus(CODE_TTL)));
            log.debug("endfield: discovered bulletin code {}", result.value());
            return result.value();
        }
        log.warn("endfield: code discovery failed ({}), using fallback {}",
                result == null ? "no result" : result.failure(), FALLBACK_CODE);
        return FALLBACK_CODE;
    }

    /** Webview HTML, then its commons bundle, then the code token inside it. */
    public Mono<DiscoveryResult> discover(String webviewUrl) {
        return fetcher.getText(webviewUrl)
                .flatMap(html -> {
                    Optional<String> commonsUrl = extractCommonsJsUrl(html).map(u -> absolutize(webviewUrl, u));
                    if (commonsUrl.isEmpty()) {
                        return Mono.just(DiscoveryResult.failure("no commons bundle in " + webviewUrl));
                    }
                    return fetcher.getText(commonsUrl.get())
                            .map(js -> extractCode(js)
                                    .map(DiscoveryResult::success)
                                    .orElseGet(() -> DiscoveryResult.failure("no bulletin code in " + commonsUrl.get())));
                })
                .onErrorResume(e -> Mono.just(DiscoveryResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage())));
    }

    void clearCache() {
        cached.set(null);
    }

    static Optional<String> extractCommonsJsUrl(String html) {
        if (html == null) return Optional.empty();
        Matcher tag = COMMONS_SCRIPT_TAG.matcher(html);
        if (tag.find()) return Optional.of(tag.group(1));
        Matcher url = COMMONS_ABSOLUTE_URL.matcher(html);
        return url.find() ? Optional.of(url.group()) : Optional.empty();
    }

    static Optional<String> extractCode(String js) {
        if (js == null) return Optional.empty();
        Matcher direct = DIRECT_CODE.matcher(js);
        if (direct.find()) return Optional.of(direct.group(1));

        Matcher any = ANY_CODE.matcher(js);
        List<String> tokens = new ArrayList<>();
        while (any.find()) {
            if (!NOT_A_CODE.equals(any.group())) tokens.add(any.group());
        }
        // max() keeps the earliest token on equal scores
        return tokens.stream().max(Comparator.comparingInt(EndfieldCodeResolver::score));
    }

    /** Suffix length, +10 with a digit, +5 with an uppercase letter. */
    static int score(String code) {
        String suffix = code.substring(PREFIX.length());
        int score = suffix.length();
        if (suffix.chars().anyMatch(Character::isDigit)) score += 10;
        if (suffix.chars().anyMatch(c -> c >= 'A' && c <= 'Z')) score += 5;
        return score;
    }

    private static String absolutize(String base, String ref) {
        try {
            return URI.create(base).resolve(ref).toString();
        } catch (IllegalArgumentException e) {
            log.debug("endfield: cannot resolve {} against {}: {}", ref, base, e.getMessage());
            return ref;
        }
    }
}
