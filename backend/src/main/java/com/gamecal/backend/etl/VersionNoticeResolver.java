package com.gamecal.backend.etl;

import com.gamecal.backend.dto.GameId;
import com.gamecal.backend.dto.GameVersionInfo;
import com.gamecal.backend.time.IsoTimes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the version notice that matters right now and reads a version label out of it.
 *
 * <p>Among notices with a valid window, an active one wins (latest start first), then the
 * nearest upcoming one, then the most recently ended one.
 */
@Component
@RequiredArgsConstructor
public class VersionNoticeResolver {

    private static final Pattern QUOTED =
            Pattern.compile("[「“\"]([^「」”\"]+)[」”\"]\\s*(?:版本)?(?:更新说明|更新公告)");
    private static final Pattern NUMERIC = Pattern.compile("(\\d+(?:\\.\\d+)+)\\s*版本");
    private static final Pattern V_PREFIX =
            Pattern.compile("(?<![A-Za-z0-9_])[Vv](\\d+(?:\\.\\d+)+)(?![A-Za-z0-9_])");

    private final Clock clock;

    public record ResolvedNotice(NoticeItem item, Instant start, Instant end) {}

    public Optional<GameVersionInfo> resolve(GameId game, List<NoticeItem> items, VersionNoticeRule rule) {
        Optional<ResolvedNotice> notice = currentNotice(items, rule);
        if (notice.isEmpty()) return Optional.empty();

        NoticeItem item = notice.get().item();
        return extractLabel(item).map(version -> GameVersionInfo.builder()
                .game(game)
                .version(version)
                .startTime(item.startIso())
                .endTime(item.endIso())
                .annId(item.annId())
                .title(HtmlCleaner.toText(item.title()))
                .build());
    }

    /** The notice {@link #pickCurrent} selects at the injected clock's current instant. */
    public Optional<ResolvedNotice> currentNotice(List<NoticeItem> items, VersionNoticeRule rule) {
        return pickCurrent(items, rule, clock.instant());
    }

    public Optional<ResolvedNotice> pickCurrent(List<NoticeItem> items, VersionNoticeRule rule, Instant now) {
        if (items == null || items.isEmpty()) return Optional.empty();

        List<ResolvedNotice> candidates = new ArrayList<>();
        for (NoticeItem item : items) {
            if (!rule.matches(item)) continue;
            Optional<Instant> start = IsoTimes.toInstant(item.startIso());
            Optional<Instant> end = IsoTimes.toInstant(item.endIso());
            if (start.isEmpty() || end.isEmpty() || !end.get().isAfter(start.get())) continue;
            candidates.add(new ResolvedNotice(item, start.get(), end.get()));
        }
        if (candidates.isEmpty()) return Optional.empty();

        Optional<ResolvedNotice> active = pick(candidates,
                n -> !n.start().isAfter(now) && now.isBefore(n.end()),
                Comparator.comparing(ResolvedNotice::start).reversed());
        if (active.isPresent()) return active;

        Optional<ResolvedNotice> upcoming = pick(candidates,
                n -> n.start().isAfter(now),
                Comparator.comparing(ResolvedNotice::start));
        if (upcoming.isPresent()) return upcoming;

        return pick(candidates, n -> true, Comparator.comparing(ResolvedNotice::end).reversed());
    }

    /** Label from the title, else from the subtitle; empty when neither carries one. */
    public Optional<String> extractLabel(NoticeItem item) {
        Optional<String> fromTitle = extractLabel(item.title());
        return fromTitle.isPresent() ? fromTitle : extractLabel(item.subtitle());
    }

    static Optional<String> extractLabel(String raw) {
        String text = HtmlCleaner.toText(raw);
        if (text.isEmpty()) return Optional.empty();

        Matcher quoted = QUOTED.matcher(text);
        if (quoted.find()) return Optional.of("「" + quoted.group(1).trim() + "」");

        Matcher numeric = NUMERIC.matcher(text);
        if (numeric.find()) return Optional.of(numeric.group(1));

        Matcher v = V_PREFIX.matcher(text);
        if (v.find()) return Optional.of(v.group(1));

        return Optional.empty();
    }

    // min() keeps the first of equal elements, matching a stable sort
    private static Optional<ResolvedNotice> pick(List<ResolvedNotice> candidates,
                                                 Predicate<ResolvedNotice> filter,
                                                 Comparator<ResolvedNotice> order) {
        return candidates.stream().filter(filter).min(order);
    }
}
