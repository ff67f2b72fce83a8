package com.gamecal.backend.etl.mihoyo;

import com.gamecal.backend.etl.NoticeItem;
import com.gamecal.backend.http.UpstreamFetcher;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Calls shared by the announcement APIs of the mihoyo-family titles. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MihoyoAnnouncements {

    private final UpstreamFetcher fetcher;

    public Mono<MihoyoAnnListResponse> list(String url) {
        return fetcher.getJson(url, MihoyoAnnListResponse.class);
    }

    /** Secondary source: any failure degrades to "no content". */
    public Mono<Optional<MihoyoAnnContentResponse>> contentOrEmpty(String url) {
        return fetcher.getJson(url, MihoyoAnnContentResponse.class)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("announcement content unavailable from {}: {}", url, e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    /** Secondary source: any failure degrades to "no list". */
    public Mono<Optional<MihoyoAnnListResponse>> listOrEmpty(String url) {
        return list(url)
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("announcement list unavailable from {}: {}", url, e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    public static Map<Long, MihoyoAnnContentResponse.ContentItem> contentById(
            Optional<MihoyoAnnContentResponse> content) {
        Map<Long, MihoyoAnnContentResponse.ContentItem> byId = new HashMap<>();
        content.ifPresent(c -> {
            for (MihoyoAnnContentResponse.ContentItem it : c.items()) {
                if (it != null && it.annId() != null) byId.put(it.annId(), it);
            }
        });
        return byId;
    }

    public static List<NoticeItem> toNoticeItems(List<MihoyoAnnListResponse.AnnItem> items, String offset) {
        return items.stream()
                .filter(it -> it.startTime() != null && it.endTime() != null)
                .map(it -> new NoticeItem(
                        it.annId(),
                        it.title(),
                        it.subtitle(),
                        IsoTimes.toIsoWithOffset(it.startTime(), offset),
                        IsoTimes.toIsoWithOffset(it.endTime(), offset)))
                .toList();
    }
}
