package com.gamecal.backend.config;

/** One optional override per upstream endpoint, plus the pre-known bulletin code. */
public enum SourceKey {
    GENSHIN_API_URL("genshin-api-url"),
    GENSHIN_CONTENT_API_URL("genshin-content-api-url"),
    STARRAIL_API_URL("starrail-api-url"),
    STARRAIL_CONTENT_API_URL("starrail-content-api-url"),
    ZZZ_API_URL("zzz-api-url"),
    ZZZ_ACTIVITY_API_URL("zzz-activity-api-url"),
    ZZZ_CONTENT_API_URL("zzz-content-api-url"),
    SNOWBREAK_ANNOUNCE_API_URL("snowbreak-announce-api-url"),
    WW_WIKI_HOME_URL("ww-wiki-home-url"),
    WW_WIKI_CATALOGUE_URL("ww-wiki-catalogue-url"),
    ENDFIELD_WEBVIEW_URL("endfield-webview-url"),
    ENDFIELD_AGGREGATE_API_URL("endfield-aggregate-api-url"),
    ENDFIELD_CODE("endfield-code");

    private final String property;

    SourceKey(String property) {
        this.property = property;
    }

    /** Property name under {@code app.upstream}. */
    public String property() {
        return property;
    }
}
