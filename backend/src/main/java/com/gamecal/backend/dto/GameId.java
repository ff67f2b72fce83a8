package com.gamecal.backend.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum GameId {
    GENSHIN("genshin", "原神"),
    STARRAIL("starrail", "崩坏：星穹铁道"),
    WW("ww", "鸣潮"),
    ZZZ("zzz", "绝区零"),
    SNOWBREAK("snowbreak", "尘白禁区"),
    ENDFIELD("endfield", "明日方舟：终末地");

    private final String wireId;
    private final String displayName;

    GameId(String wireId, String displayName) {
        this.wireId = wireId;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireId() {
        return wireId;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<GameId> fromWireId(String id) {
        if (id == null) return Optional.empty();
        String s = id.trim();
        return Arrays.stream(values()).filter(g -> g.wireId.equals(s)).findFirst();
    }
}
