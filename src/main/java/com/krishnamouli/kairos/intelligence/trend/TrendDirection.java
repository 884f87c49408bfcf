package com.krishnamouli.kairos.intelligence.trend;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    INCREASING, DECREASING, STABLE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
