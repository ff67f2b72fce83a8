package com.gamecal.backend.etl.ww;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** One catalogue page of wiki entries, used for their cover images. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KuroCatalogueResponse(Integer code, String msg, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(Results results) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Results(List<Record> records) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Record(String entryId, Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String contentUrl) {}

    public List<Record> records() {
        if (data == null || data.results() == null || data.results().records() == null) return List.of();
        return data.results().records();
    }
}
