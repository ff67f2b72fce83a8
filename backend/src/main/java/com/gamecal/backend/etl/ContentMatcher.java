package com.gamecal.backend.etl;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks the detail record whose title best matches an activity title. Lower score wins:
 * equal keys score 0, a candidate containing the activity key scores {@code 10 + extra chars},
 * the reverse scores {@code 30 + missing chars}. Candidates without body text get +1000 and
 * those without a banner +100. Unrelated keys are never considered.
 */
@Component
public class ContentMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00a0\\u3000]+");
    private static final Pattern QUOTES = Pattern.compile("[「」『』“”\"'’‘〝〞＂＇]");

    public Optional<ContentCandidate> bestMatch(String activityTitle, List<ContentCandidate> candidates) {
        String activityKey = matchKey(activityTitle);
        if (activityKey.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        ContentCandidate best = null;
        int bestScore = Integer.MAX_VALUE;

        for (ContentCandidate c : candidates) {
            String key = c.key();
            if (key == null || key.isEmpty()) continue;

            int score;
            if (key.equals(activityKey)) {
                score = 0;
            } else if (key.contains(activityKey)) {
                score = 10 + (key.length() - activityKey.length());
            } else if (activityKey.contains(key)) {
                score = 30 + (activityKey.length() - key.length());
            } else {
                continue;
            }

            if (c.content() == null || c.content().isBlank()) score += 1000;
            if (c.banner() == null || c.banner().isBlank()) score += 100;

            if (score < bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Lowercased plain text with whitespace and quote marks of any style removed. */
    public static String matchKey(String title) {
        String text = HtmlCleaner.toText(title).toLowerCase(Locale.ROOT);
        text = WHITESPACE.matcher(text).replaceAll("");
        return QUOTES.matcher(text).replaceAll("");
    }
}
