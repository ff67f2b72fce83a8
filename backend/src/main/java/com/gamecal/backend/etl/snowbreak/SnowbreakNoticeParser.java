package com.gamecal.backend.etl.snowbreak;

import com.gamecal.backend.etl.HtmlCleaner;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the long "限时活动公告" body into heading-delimited blocks and reads every
 * "…活动时间：A - B" line inside them.
 */
final class SnowbreakNoticeParser {

    private SnowbreakNoticeParser() {}

    static final String IMAGE_MARKER = "@@IMG@@";

    private static final Pattern NUMBERED_HEADING = Pattern.compile("^[一二三四五六七八九十]+、");
    private static final Pattern BRACKET_HEADING = Pattern.compile("^【[^】]+】$");
    private static final Pattern NUMBERED_PREFIX = Pattern.compile("^[一二三四五六七八九十]+、\\s*");

    private static final Pattern TIME_LINE = Pattern.compile("^([^:：]{0,24}?)活动时间[:：]\\s*(.+)$");
    private static final Pattern RANGE = Pattern.compile("(.+?)\\s*(?:-|~|～|至|到|—|–)\\s*(.+)");

    private static final Pattern CN_DATE = Pattern.compile("(?:(\\d{4})年)?(\\d{1,2})月(\\d{1,2})日?");
    private static final Pattern SLASH_DATE = Pattern.compile("(?:(\\d{4})[./-])?(\\d{1,2})[./-](\\d{1,2})");
    private static final Pattern CLOCK = Pattern.compile("(\\d{1,2})[:：](\\d{1,2})(?:[:：](\\d{1,2}))?");
    private static final Pattern CN_CLOCK = Pattern.compile("(\\d{1,2})点(?:(\\d{1,2})分?)?");

    private static final String AFTER_MAINTENANCE = "维护后";
    private static final String PERMANENT = "常驻";
    private static final int MAINTENANCE_END_HOUR = 4;

    record Block(String title, String banner, List<String> lines) {}

    /** One "活动时间" line: the text before the keyword and the two raw range ends. */
    record TimeLine(String prefix, String startRaw, String endRaw) {}

    /** Visible lines of the body in order; images become {@code @@IMG@@<src>} lines. */
    static List<String> tokenize(String html) {
        if (html == null || html.isBlank()) return List.of();
        String source = html;
        if (!source.contains("<") && source.contains("&lt;")) {
            source = Parser.unescapeEntities(source, false);
        }

        Document doc = Jsoup.parseBodyFragment(source);
        doc.select("script, style").remove();
        for (Element img : doc.select("img[src]")) {
            img.replaceWith(new TextNode("\n" + IMAGE_MARKER + img.attr("src").trim() + "\n"));
        }
        for (Element br : doc.select("br")) {
            br.replaceWith(new TextNode("\n"));
        }
        for (Element el : doc.select("p, div, li, h1, h2, h3, h4, h5, h6, tr")) {
            el.appendText("\n");
        }

        List<String> lines = new ArrayList<>();
        for (String raw : doc.body().wholeText().split("\n")) {
            String line = HtmlCleaner.collapse(raw);
            if (!line.isEmpty()) lines.add(line);
        }
        return lines;
    }

    static String parseHeading(String line) {
        String s = HtmlCleaner.collapse(line);
        if (s.isEmpty()) return null;
        if (s.startsWith("✧")) return HtmlCleaner.collapse(s.substring(1));
        if (NUMBERED_HEADING.matcher(s).find()) return s;
        if (BRACKET_HEADING.matcher(s).matches()) return s;
        return null;
    }

    /** Lines before the first heading are dropped; an image just before a heading is its banner. */
    static List<Block> parseBlocks(List<String> lines) {
        List<Block> blocks = new ArrayList<>();
        String pendingBanner = null;
        String title = null;
        String banner = null;
        List<String> body = null;

        for (String line : lines) {
            if (line.startsWith(IMAGE_MARKER)) {
                String src = line.substring(IMAGE_MARKER.length()).trim();
                pendingBanner = src.isEmpty() ? null : src;
                continue;
            }
            String heading = parseHeading(line);
            if (heading != null) {
                if (title != null) blocks.add(new Block(title, banner, List.copyOf(body)));
                title = heading;
                banner = pendingBanner;
                body = new ArrayList<>();
                pendingBanner = null;
                continue;
            }
            if (body != null) body.add(line);
        }
        if (title != null) blocks.add(new Block(title, banner, List.copyOf(body)));
        return blocks;
    }

    static TimeLine parseTimeLine(String line) {
        Matcher m = TIME_LINE.matcher(line);
        if (!m.matches()) return null;
        Matcher range = RANGE.matcher(m.group(2));
        if (!range.matches()) return null;
        return new TimeLine(m.group(1), range.group(1).trim(), range.group(2).trim());
    }

    /**
     * Reads one end of a range. Dates are {@code [YYYY年]M月D[日]} or {@code [YYYY/]M/D};
     * times are {@code H:MM[:SS]} (full-width colons allowed) or {@code H点[M分]}. "维护后"
     * means 04:00, on the anchor day when no date is given. "常驻" has no end and yields null.
     */
    static LocalDateTime parseDatePoint(String raw, LocalDate anchor) {
        String source = raw == null ? "" : raw.replaceAll("\\s+", "");
        if (source.isEmpty() || source.contains(PERMANENT)) return null;
        boolean afterMaintenance = source.contains(AFTER_MAINTENANCE);

        Matcher date = CN_DATE.matcher(source);
        if (!date.find()) {
            date = SLASH_DATE.matcher(source);
            if (!date.find()) {
                return afterMaintenance ? anchor.atTime(MAINTENANCE_END_HOUR, 0) : null;
            }
        }

        int month = Integer.parseInt(date.group(2));
        int day = Integer.parseInt(date.group(3));
        int year = date.group(1) != null ? Integer.parseInt(date.group(1)) : inferYear(month, anchor);
        String rest = source.substring(date.end());

        int hour = afterMaintenance ? MAINTENANCE_END_HOUR : 0;
        int minute = 0;
        int second = 0;
        Matcher clock = CLOCK.matcher(rest);
        if (clock.find()) {
            hour = Integer.parseInt(clock.group(1));
            minute = Integer.parseInt(clock.group(2));
            second = clock.group(3) == null ? 0 : Integer.parseInt(clock.group(3));
        } else {
            Matcher cn = CN_CLOCK.matcher(rest);
            if (cn.find()) {
                hour = Integer.parseInt(cn.group(1));
                minute = cn.group(2) == null ? 0 : Integer.parseInt(cn.group(2));
            }
        }

        try {
            return LocalDateTime.of(year, month, day, hour, minute, second);
        } catch (DateTimeException e) {
            return null;
        }
    }

    /** A month six or more away from the anchor month belongs to the neighbouring year. */
    static int inferYear(int month, LocalDate anchor) {
        if (month < 1 || month > 12) return anchor.getYear();
        int anchorMonth = anchor.getMonthValue();
        if (Math.abs(month - anchorMonth) >= 6) {
            return month < anchorMonth ? anchor.getYear() + 1 : anchor.getYear() - 1;
        }
        return anchor.getYear();
    }

    /** Combines the block heading with whatever precedes "活动时间" on the time line. */
    static String buildEventTitle(String blockTitle, String prefix) {
        String base = HtmlCleaner.collapse(NUMBERED_PREFIX.matcher(blockTitle).replaceFirst(""));
        String p = HtmlCleaner.collapse(prefix == null ? "" : prefix.replaceAll("[：:]", ""));
        if (p.isEmpty() || p.equals("活动")) return base;
        if (p.equals("上半期") || p.equals("下半期")) return base + "（" + p + "）";
        if (base.contains(p)) return base;
        return base + "·" + p;
    }

    static String blockContent(Block block) {
        List<String> all = new ArrayList<>();
        all.add(block.title());
        all.addAll(block.lines());
        return String.join("<br>", all);
    }
}
