package com.gamecal.backend.etl.endfield;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Bulletin aggregate: every tab's items with their HTML body inlined. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HypergryphAggregateResponse(Integer code, String msg, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(List<Item> list) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(String cid, String tab, String title, Long startAt, Body data) {
        public String html() {
            return data == null ? null : data.html();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Body(String html) {}

    public List<Item> items() {
        return (data == null || data.list() == null) ? List.of() : data.list();
    }
}
