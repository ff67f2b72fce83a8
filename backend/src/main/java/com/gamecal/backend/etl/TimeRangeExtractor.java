package com.gamecal.backend.etl;

import com.gamecal.backend.time.IsoTimes;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a start/end pair from an announcement body. Strategies are tried in order and the
 * first that yields anything wins:
 * <ol>
 *     <li>an explicit {@code <date-time> <separator> <date-time>} range;</li>
 *     <li>keyword-prefixed start and/or end ("活动时间", "结束时间", ...);</li>
 *     <li>every date-time token in document order: one token is the end, two or more give start and end.</li>
 * </ol>
 */
@Component
public class TimeRangeExtractor {

    private static final String DATE_TIME = "\\d{4}[/.\\-]\\d{1,2}[/.\\-]\\d{1,2}\\s*\\d{1,2}:\\d{2}(?::\\d{2})?";
    private static final String SEPARATOR = "(?:-|~|～|至|到|—|–)";
    private static final String START_WORDS = "(?:开放时间|活动时间|开启时间|开始时间)";
    private static final String END_WORDS = "(?:结束时间|截止时间|截至|截止)";

    private static final Pattern RANGE =
            Pattern.compile("(" + DATE_TIME + ")\\s*" + SEPARATOR + "\\s*(" + DATE_TIME + ")");
    // the gap after a start keyword may not cross a range separator, or "至 <end>" would read as a start
    private static final Pattern START_KEYWORD =
            Pattern.compile(START_WORDS + "[^0-9\\-~～至到—–]{0,40}(" + DATE_TIME + ")");
    private static final Pattern END_KEYWORD =
            Pattern.compile(END_WORDS + "[^0-9]{0,40}(" + DATE_TIME + ")");
    // "活动时间：公测开启后 - 2026/03/01 04:00" has a fuzzy start but an explicit end
    private static final Pattern END_AFTER_FUZZY_START =
            Pattern.compile(START_WORDS + "[^0-9]{0,80}" + SEPARATOR + "\\s*(" + DATE_TIME + ")");
    private static final Pattern ANY_DATE_TIME = Pattern.compile("(" + DATE_TIME + ")");

    private static final Pattern STRICT =
            Pattern.compile("^(\\d{4})[/.\\-](\\d{1,2})[/.\\-](\\d{1,2})\\s*(\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");
    private static final DateTimeFormatter NAIVE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public TimeRange extract(String html, String sourceOffset) {
        String text = HtmlCleaner.toText(html);
        if (text.isEmpty()) return TimeRange.empty();

        Matcher range = RANGE.matcher(text);
        if (range.find()) {
            return toRange(normalizeCandidate(range.group(1)), normalizeCandidate(range.group(2)), sourceOffset);
        }

        String start = firstGroup(START_KEYWORD, text);
        String end = firstGroup(END_KEYWORD, text);
        if (end == null) {
            end = firstGroup(END_AFTER_FUZZY_START, text);
        }
        if (start != null || end != null) {
            return toRange(start, end, sourceOffset);
        }

        List<String> all = allCandidates(text);
        if (all.isEmpty()) return TimeRange.empty();
        if (all.size() == 1) return toRange(null, all.get(0), sourceOffset);
        return toRange(all.get(0), all.get(1), sourceOffset);
    }

    /**
     * Validates a loosely formatted token such as {@code 2026/3/1 4:00} and rewrites it as
     * {@code 2026-03-01 04:00:00}. Returns null for anything that is not a real date-time.
     */
    static String normalizeCandidate(String input) {
        if (input == null) return null;
        String source = input.trim();
        if (source.isEmpty()) return null;

        Matcher m = STRICT.matcher(source);
        if (!m.matches()) return null;

        try {
            LocalDateTime t = LocalDateTime.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)),
                    Integer.parseInt(m.group(5)),
                    m.group(6) == null ? 0 : Integer.parseInt(m.group(6)));
            return t.format(NAIVE);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static String firstGroup(Pattern p, String text) {
        Matcher m = p.matcher(text);
        while (m.find()) {
            String v = normalizeCandidate(m.group(1));
            if (v != null) return v;
        }
        return null;
    }

    private static List<String> allCandidates(String text) {
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = ANY_DATE_TIME.matcher(text);
        while (m.find()) {
            String v = normalizeCandidate(m.group(1));
            if (v != null) seen.add(v);
        }
        return new ArrayList<>(seen);
    }

    private static TimeRange toRange(String startNaive, String endNaive, String offset) {
        return new TimeRange(
                startNaive == null ? null : IsoTimes.toIsoWithOffset(startNaive, offset),
                endNaive == null ? null : IsoTimes.toIsoWithOffset(endNaive, offset));
    }
}
