package com.gamecal.backend.etl;

import java.util.List;

/**
 * Decides whether a title or subtitle marks a version-update notice. Exclusions are checked
 * first, so "...维护预告" never qualifies even when it also says "版本更新".
 */
public record VersionNoticeRule(List<String> includes, List<String> excludes) {

    public VersionNoticeRule {
        includes = List.copyOf(includes);
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
    }

    public boolean matches(String raw) {
        String text = HtmlCleaner.toText(raw);
        if (text.isEmpty()) return false;
        if (excludes.stream().anyMatch(text::contains)) return false;
        return includes.stream().anyMatch(text::contains);
    }

    public boolean matches(NoticeItem item) {
        return matches(item.title()) || matches(item.subtitle());
    }
}
