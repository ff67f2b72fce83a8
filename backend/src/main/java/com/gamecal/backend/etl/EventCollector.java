package com.gamecal.backend.etl;

import com.gamecal.backend.dto.CalendarEvent;
import com.gamecal.backend.time.IsoTimes;
import lombok.extern.slf4j.Slf4j;

import java.text.Collator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the events of one pipeline run. Events whose end is not after their start are
 * dropped; events sharing an id are merged into the widest window, keeping whichever banner
 * and content are present.
 */
@Slf4j
public final class EventCollector {

    private static final Collator ZH = Collator.getInstance(Locale.SIMPLIFIED_CHINESE);

    /** Start, then end, then id under Chinese collation. */
    public static final Comparator<CalendarEvent> ORDER = Comparator
            .comparing((CalendarEvent e) -> instant(e.startTime()))
            .thenComparing(e -> instant(e.endTime()))
            .thenComparing(CalendarEvent::id, ZH);

    private final Map<String, CalendarEvent> byId = new LinkedHashMap<>();

    public boolean add(CalendarEvent event) {
        if (!hasPositiveDuration(event)) {
            log.debug("dropping event {} with invalid window {} .. {}", event.id(), event.startTime(), event.endTime());
            return false;
        }
        byId.merge(event.id(), event, EventCollector::merge);
        return true;
    }

    public void addAll(List<CalendarEvent> events) {
        events.forEach(this::add);
    }

    public int size() {
        return byId.size();
    }

    public List<CalendarEvent> sorted() {
        List<CalendarEvent> out = new ArrayList<>(byId.values());
        out.sort(ORDER);
        return List.copyOf(out);
    }

    public static boolean hasPositiveDuration(CalendarEvent event) {
        Optional<Instant> start = IsoTimes.toInstant(event.startTime());
        Optional<Instant> end = IsoTimes.toInstant(event.endTime());
        return start.isPresent() && end.isPresent() && end.get().isAfter(start.get());
    }

    static CalendarEvent merge(CalendarEvent prev, CalendarEvent next) {
        boolean keepPrevStart = !instant(prev.startTime()).isAfter(instant(next.startTime()));
        boolean keepPrevEnd = !instant(prev.endTime()).isBefore(instant(next.endTime()));
        return prev.toBuilder()
                .startTime(keepPrevStart ? prev.startTime() : next.startTime())
                .endTime(keepPrevEnd ? prev.endTime() : next.endTime())
                .gacha(prev.gacha() || next.gacha())
                .banner(prev.banner() != null ? prev.banner() : next.banner())
                .content(prev.content() != null ? prev.content() : next.content())
                .linkUrl(prev.linkUrl() != null ? prev.linkUrl() : next.linkUrl())
                .build();
    }

    private static Instant instant(String iso) {
        return IsoTimes.toInstant(iso).orElse(Instant.EPOCH);
    }
}
