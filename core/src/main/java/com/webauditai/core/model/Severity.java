package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 이슈 심각도. rank가 작을수록 더 심각(정렬 1차 키). */
public enum Severity {
    CRITICAL(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    Severity(int rank) { this.rank = rank; }

    public int rank() { return rank; }

    @JsonValue
    public String key() { return name().toLowerCase(Locale.ROOT); }

    /** 알 수 없는 값은 LOW로 취급 */
    @JsonCreator
    public static Severity fromKey(String key) {
        if (key == null) return LOW;
        for (Severity s : values()) {
            if (s.name().equalsIgnoreCase(key.trim())) return s;
        }
        return LOW;
    }
}
