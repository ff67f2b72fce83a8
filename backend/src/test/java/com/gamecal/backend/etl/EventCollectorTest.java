package com.gamecal.backend.etl;

import com.gamecal.backend.dto.CalendarEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventCollectorTest {

    private static CalendarEvent event(String id, String start, String end) {
        return CalendarEvent.builder().id(id).title(id).startTime(start).endTime(end).build();
    }

    @Test
    void mergesCollisionsIntoTheWidestWindow() {
        EventCollector collector = new EventCollector();
        collector.add(event("1", "2026-03-05T10:00:00+08:00", "2026-03-20T04:00:00+08:00"));
        collector.add(event("1", "2026-03-01T10:00:00+08:00", "2026-03-15T04:00:00+08:00")
                .toBuilder().banner("x").build());

        List<CalendarEvent> out = collector.sorted();

        assertThat(out).hasSize(1);
        assertThat(out.get(0).startTime()).isEqualTo("2026-03-01T10:00:00+08:00");
        assertThat(out.get(0).endTime()).isEqualTo("2026-03-20T04:00:00+08:00");
        assertThat(out.get(0).banner()).isEqualTo("x");
    }

    @Test
    void comparesInstantsNotStrings() {
        CalendarEvent prev = event("1", "2026-03-01T10:00:00+08:00", "2026-03-10T10:00:00+08:00");
        // 03:00Z is 11:00 at +08:00, so prev still has the earlier start
        CalendarEvent next = event("1", "2026-03-01T03:00:00Z", "2026-03-10T03:00:00Z").toBuilder().gacha(true).build();

        CalendarEvent merged = EventCollector.merge(prev, next);

        assertThat(merged.startTime()).isEqualTo(prev.startTime());
        assertThat(merged.endTime()).isEqualTo(next.endTime());
        assertThat(merged.gacha()).isTrue();
    }

    @Test
    void firstBannerAndContentWin() {
        CalendarEvent prev = event("1", "2026-03-01T10:00:00+08:00", "2026-03-10T10:00:00+08:00")
                .toBuilder().banner("a").build();
        CalendarEvent next = event("1", "2026-03-01T10:00:00+08:00", "2026-03-10T10:00:00+08:00")
                .toBuilder().banner("b").content("body").build();

        CalendarEvent merged = EventCollector.merge(prev, next);

        assertThat(merged.banner()).isEqualTo("a");
        assertThat(merged.content()).isEqualTo("body");
    }

    @Test
    void dropsEventsWithoutPositiveDuration() {
        EventCollector collector = new EventCollector();

        assertThat(collector.add(event("zero", "2026-03-01T10:00:00+08:00", "2026-03-01T10:00:00+08:00"))).isFalse();
        assertThat(collector.add(event("backwards", "2026-03-02T10:00:00+08:00", "2026-03-01T10:00:00+08:00"))).isFalse();
        assertThat(collector.add(event("unparsed", "soon", "2026-03-01T10:00:00+08:00"))).isFalse();
        assertThat(collector.sorted()).isEmpty();
    }

    @Test
    void sortsByStartThenEndThenId() {
        EventCollector collector = new EventCollector();
        collector.add(event("b", "2026-03-01T10:00:00+08:00", "2026-03-10T10:00:00+08:00"));
        collector.add(event("a", "2026-03-01T10:00:00+08:00", "2026-03-10T10:00:00+08:00"));
        collector.add(event("c", "2026-03-01T10:00:00+08:00", "2026-03-05T10:00:00+08:00"));
        collector.add(event("d", "2026-02-28T10:00:00+08:00", "2026-03-20T10:00:00+08:00"));

        assertThat(collector.sorted()).extracting(CalendarEvent::id).containsExactly("d", "c", "a", "b");
    }

    @Test
    void everyEmittedEventEndsAfterItStarts() {
        EventCollector collector = new EventCollector();
        collector.addAll(List.of(
                event("1", "2026-03-01T10:00:00+08:00", "2026-03-02T10:00:00+08:00"),
                event("2", "2026-03-03T10:00:00+08:00", "2026-03-01T10:00:00+08:00"),
                event("3", "2026-03-01", "2026-03-02")));

        assertThat(collector.sorted()).allMatch(EventCollector::hasPositiveDuration).hasSize(1);
    }
}
