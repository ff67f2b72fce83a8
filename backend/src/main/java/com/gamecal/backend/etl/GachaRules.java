package com.gamecal.backend.etl;

import com.gamecal.backend.dto.GameId;

/** Which titles announce a limited pull banner. Each game has its own vocabulary. */
public final class GachaRules {

    private GachaRules() {}

    public static boolean isGacha(GameId game, String title) {
        String t = title == null ? "" : title.trim();
        if (t.isEmpty()) return false;

        return switch (game) {
            case GENSHIN -> t.contains("祈愿");
            case STARRAIL -> t.contains("跃迁");
            case WW -> t.contains("唤取");
            case ZZZ -> t.contains("限时频段") || t.contains("独家频段");
            case SNOWBREAK -> t.contains("共鸣开启");
            case ENDFIELD -> t.contains("特许寻访");
        };
    }
}
