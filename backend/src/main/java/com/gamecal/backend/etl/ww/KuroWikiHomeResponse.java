package com.gamecal.backend.etl.ww;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Wiki home page. Only the side modules are of interest. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KuroWikiHomeResponse(Integer code, String msg, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(ContentJson contentJson) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentJson(List<SideModule> sideModules) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SideModule(String title, List<Entry> content, More more) {
        public List<Entry> entries() {
            return content == null ? List.of() : content;
        }

        public Long catalogueId() {
            return (more == null || more.linkConfig() == null) ? null : more.linkConfig().catalogueId();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String title, String contentUrl, LinkConfig linkConfig, CountDown countDown) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkConfig(String linkUrl, String entryId, Long catalogueId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CountDown(List<String> dateRange) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record More(LinkConfig linkConfig) {}

    public List<SideModule> sideModules() {
        if (data == null || data.contentJson() == null || data.contentJson().sideModules() == null) {
            return List.of();
        }
        return data.contentJson().sideModules();
    }
}
