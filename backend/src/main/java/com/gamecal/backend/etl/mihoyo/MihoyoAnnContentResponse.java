package com.gamecal.backend.etl.mihoyo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** {@code getAnnContent}: full HTML bodies, no reliable start/end fields. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MihoyoAnnContentResponse(Integer retcode, String message, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            List<ContentItem> list,
            @JsonProperty("pic_list") List<ContentItem> picList
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentItem(
            @JsonProperty("ann_id") Long annId,
            String title,
            String subtitle,
            String banner,
            String img,
            String content
    ) {
        /** {@code banner}, or {@code img} for picture entries. */
        public String bannerOrImage() {
            if (banner != null && !banner.isBlank()) return banner.trim();
            if (img != null && !img.isBlank()) return img.trim();
            return null;
        }
    }

    public List<ContentItem> items() {
        return (data == null || data.list() == null) ? List.of() : data.list();
    }

    /** Text entries followed by picture entries. */
    public List<ContentItem> allItems() {
        List<ContentItem> out = new ArrayList<>(items());
        if (data != null && data.picList() != null) out.addAll(data.picList());
        return out;
    }
}
