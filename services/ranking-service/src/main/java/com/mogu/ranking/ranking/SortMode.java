package com.mogu.ranking.ranking;

import java.util.Locale;

public enum SortMode {
    AI_RECOMMENDED("ai_recommended"),
    RECENT("recent"),
    DISTANCE("distance");

    private final String param;

    SortMode(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static SortMode fromParam(String value) {
        if (value == null || value.isBlank()) {
            return AI_RECOMMENDED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortMode mode : values()) {
            if (mode.param.equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
