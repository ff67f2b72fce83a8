package com.gamecal.backend.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts upstream timestamps into ISO-8601 strings that carry an explicit offset.
 *
 * <p>Publishers return wall-clock values like {@code 2026-03-01 04:00:00} with no zone.
 * Each source has a fixed offset, which is appended so a client can convert the value
 * into any display zone without guessing.
 */
public final class IsoTimes {

    private IsoTimes() {}

    private static final Pattern UTC_PREFIX = Pattern.compile("^(?i)(UTC|GMT)\\s*");
    private static final Pattern OFFSET_LOOSE = Pattern.compile("^([+-])(\\d{1,2})(?::?(\\d{2}))?$");
    private static final Pattern OFFSET_COMPACT = Pattern.compile("^([+-])(\\d{2})(\\d{2})$");

    private static final Pattern HAS_ZONE = Pattern.compile("(?:[zZ]|[+-]\\d{2}:?\\d{2})$");
    private static final Pattern COMPACT_SUFFIX = Pattern.compile("([+-])(\\d{2})(\\d{2})$");

    private static final Pattern ISO_LOCAL = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}(:\\d{2})?$");
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DATE_HM = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}$");
    private static final Pattern DATE_HMS = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}$");

    // 0001-01-02T00:00:00Z and 9999-12-30T23:59:59Z, one day inside the four-digit years
    private static final long MIN_EPOCH_SECONDS = -62135510400L;
    private static final long MAX_EPOCH_SECONDS = 253402214399L;

    private static final DateTimeFormatter LOCAL_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    /**
     * Canonicalizes an offset such as {@code +8}, {@code -0800}, {@code UTC+8},
     * {@code GMT+08:00} or {@code Z} into {@code ±HH:MM}.
     *
     * @throws IllegalArgumentException for blank input, unknown shapes or out-of-range fields
     */
    public static String normalizeOffset(String input) {
        String raw = input == null ? "" : input.trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("source offset is required");
        }

        String s = UTC_PREFIX.matcher(raw).replaceFirst("").trim();
        if (s.equalsIgnoreCase("Z")) return "+00:00";

        Matcher m = OFFSET_LOOSE.matcher(s);
        if (!m.matches()) {
            m = OFFSET_COMPACT.matcher(s);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid source offset: " + input);
            }
        }

        int hh = Integer.parseInt(m.group(2));
        int mm = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        if (hh > 23 || mm > 59) {
            throw new IllegalArgumentException("Invalid source offset: " + input);
        }
        return String.format("%s%02d:%02d", m.group(1), hh, mm);
    }

    /**
     * Appends {@code sourceOffset} to a naive timestamp, or canonicalizes the suffix of one
     * that already carries a zone. Shapes that are not recognized are returned untouched.
     */
    public static String toIsoWithOffset(String input, String sourceOffset) {
        String offset = normalizeOffset(sourceOffset);
        if (input == null) return null;
        String s = input.trim();
        if (s.isEmpty()) return input;

        if (HAS_ZONE.matcher(s).find()) {
            return canonicalizeSuffix(s);
        }
        if (ISO_LOCAL.matcher(s).matches()) {
            return (s.length() == 16 ? s + ":00" : s) + offset;
        }
        if (DATE_ONLY.matcher(s).matches()) {
            return s + "T00:00:00" + offset;
        }
        if (DATE_HM.matcher(s).matches()) {
            return s.replace(' ', 'T') + ":00" + offset;
        }
        if (DATE_HMS.matcher(s).matches()) {
            return s.replace(' ', 'T') + offset;
        }
        return input;
    }

    /**
     * Formats an epoch-second value as the wall-clock time at {@code sourceOffset},
     * followed by that same offset. The instant is shifted by the offset's minutes and the
     * calendar fields are read in UTC, so any offset {@link #normalizeOffset} accepts works.
     *
     * @throws IllegalArgumentException when the offset is invalid or the value is outside
     *                                  {@link #isSupportedEpochSeconds(long)}
     */
    public static String unixSecondsToIsoWithOffset(long epochSeconds, String sourceOffset) {
        String offset = normalizeOffset(sourceOffset);
        if (!isSupportedEpochSeconds(epochSeconds)) {
            throw new IllegalArgumentException("Epoch seconds out of range: " + epochSeconds);
        }
        LocalDateTime local = LocalDateTime.ofEpochSecond(
                epochSeconds + offsetMinutes(offset) * 60L, 0, ZoneOffset.UTC);
        return local.format(LOCAL_SECONDS) + offset;
    }

    /** True when the value formats to a four-digit year at every accepted offset. */
    public static boolean isSupportedEpochSeconds(long epochSeconds) {
        return epochSeconds >= MIN_EPOCH_SECONDS && epochSeconds <= MAX_EPOCH_SECONDS;
    }

    /**
     * Same as {@link #unixSecondsToIsoWithOffset(long, String)} for values that arrive as text.
     * Non-numeric input is returned unchanged.
     */
    public static String unixSecondsToIsoWithOffset(String epochSeconds, String sourceOffset) {
        Optional<Long> seconds = parseEpochSeconds(epochSeconds);
        if (seconds.isEmpty()) {
            normalizeOffset(sourceOffset);
            return epochSeconds;
        }
        return unixSecondsToIsoWithOffset(seconds.get(), sourceOffset);
    }

    /** Parses an ISO string with offset into an instant; empty when it does not parse. */
    public static Optional<Instant> toInstant(String iso) {
        if (iso == null || iso.isBlank()) return Optional.empty();
        try {
            return Optional.of(OffsetDateTime.parse(iso.trim()).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Accepts integral and fractional numbers; fractions are truncated. Values outside
     * {@link #isSupportedEpochSeconds(long)} are empty.
     */
    public static Optional<Long> parseEpochSeconds(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            double d = Double.parseDouble(value.trim());
            if (!Double.isFinite(d) || d < MIN_EPOCH_SECONDS || d > MAX_EPOCH_SECONDS + 1d) {
                return Optional.empty();
            }
            long seconds = (long) d;
            return isSupportedEpochSeconds(seconds) ? Optional.of(seconds) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static int offsetMinutes(String normalized) {
        int minutes = Integer.parseInt(normalized.substring(1, 3)) * 60 + Integer.parseInt(normalized.substring(4, 6));
        return normalized.charAt(0) == '-' ? -minutes : minutes;
    }

    private static String canonicalizeSuffix(String s) {
        Matcher m = COMPACT_SUFFIX.matcher(s);
        if (!m.find()) return s;
        return s.substring(0, s.length() - 5) + m.group(1) + m.group(2) + ":" + m.group(3);
    }
}
