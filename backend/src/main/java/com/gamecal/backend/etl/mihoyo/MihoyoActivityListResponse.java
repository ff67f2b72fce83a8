package com.gamecal.backend.etl.mihoyo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** {@code getActivityList}: activities with epoch-second bounds sent as strings. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MihoyoActivityListResponse(Integer retcode, String message, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(@JsonProperty("activity_list") List<Activity> activityList) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Activity(
            @JsonProperty("activity_id") String activityId,
            String name,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime
    ) {}

    public List<Activity> activities() {
        return (data == null || data.activityList() == null) ? List.of() : data.activityList();
    }
}
