package com.gamecal.backend.etl.mihoyo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/** {@code getAnnList}: announcements grouped by category, with structured start/end. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MihoyoAnnListResponse(Integer retcode, String message, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(List<Category> list) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Category(
            @JsonProperty("type_id") Integer typeId,
            @JsonProperty("type_label") String typeLabel,
            List<AnnItem> list
    ) {
        public List<AnnItem> items() {
            return list == null ? List.of() : list;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnnItem(
            @JsonProperty("ann_id") Long annId,
            String title,
            String subtitle,
            String banner,
            String content,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime
    ) {}

    public List<Category> categories() {
        return (data == null || data.list() == null) ? List.of() : data.list();
    }

    public Optional<Category> categoryById(int typeId) {
        return categories().stream()
                .filter(c -> c.typeId() != null && c.typeId() == typeId)
                .findFirst();
    }

    public Optional<Category> categoryByLabel(String labelPart) {
        return categories().stream()
                .filter(c -> c.typeLabel() != null && c.typeLabel().contains(labelPart))
                .findFirst();
    }
}
