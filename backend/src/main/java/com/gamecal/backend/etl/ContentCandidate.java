package com.gamecal.backend.etl;

/** A detail record reduced to a matchable key plus what it can contribute to an event. */
public record ContentCandidate(String titleText, String key, String banner, String content) {

    public static ContentCandidate of(String rawTitle, String banner, String content) {
        String titleText = HtmlCleaner.toText(rawTitle);
        return new ContentCandidate(titleText, ContentMatcher.matchKey(titleText), banner, content);
    }
}
