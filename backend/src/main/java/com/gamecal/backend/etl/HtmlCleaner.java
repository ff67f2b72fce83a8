package com.gamecal.backend.etl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.regex.Pattern;

public final class HtmlCleaner {

    private HtmlCleaner() {}

    private static final Pattern TAG = Pattern.compile("<[a-zA-Z/!][^>]*>");
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00a0\\u3000]+");

    /**
     * Plain text of an HTML fragment: tags dropped, entities decoded, whitespace collapsed.
     * Bodies that arrive entity-escaped ({@code &lt;p&gt;...}) are unwrapped once more.
     */
    public static String toText(String html) {
        if (html == null || html.isBlank()) return "";
        String text = Jsoup.parse(html).text();
        if (TAG.matcher(text).find()) {
            text = Jsoup.parse(text).text();
        }
        return collapse(text);
    }

    /** {@code src} of the first image in the fragment, or null. */
    public static String firstImageSrc(String html) {
        if (html == null || html.isBlank()) return null;
        Element img = Jsoup.parseBodyFragment(html).selectFirst("img[src]");
        if (img == null) return null;
        String src = img.attr("src").trim();
        return src.isEmpty() ? null : src;
    }

    public static String collapse(String text) {
        if (text == null) return "";
        return SPACES.matcher(text).replaceAll(" ").trim();
    }
}
