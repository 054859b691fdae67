package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** llms.txt 상태: 50자(trim) 이상 present, 그 미만 thin, 없음 missing */
public enum LlmsTxtStatus {
    PRESENT, THIN, MISSING;

    public static final int MIN_CHARS = 50;

    public static LlmsTxtStatus of(String llmsTxt) {
        if (llmsTxt == null || llmsTxt.isEmpty()) return MISSING;
        return llmsTxt.strip().length() >= MIN_CHARS ? PRESENT : THIN;
    }

    @JsonValue
    public String key() { return name().toLowerCase(java.util.Locale.ROOT); }
}
