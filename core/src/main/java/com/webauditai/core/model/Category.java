package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 7개 점수 카테고리. 선언 순서 = AuditResult.categories 출력 순서.
 * 기본 가중치 합계는 1.00.
 */
public enum Category {
    TECHNICAL("technical", "Technical SEO", 0.20, "Analyzing technical SEO...", 25),
    CONTENT("content", "Content Quality", 0.20, "Analyzing content quality (AI-powered)...", 35),
    ONPAGE("onpage", "On-Page SEO", 0.15, "Analyzing on-page SEO...", 55),
    SCHEMA("schema", "Schema & Structured Data", 0.10, "Analyzing structured data...", 65),
    PERFORMANCE("performance", "Performance", 0.10, "Analyzing performance...", 75),
    IMAGES("images", "Image Optimization", 0.05, "Analyzing images...", 85),
    GEO("geo", "AI Search (GEO)", 0.20, "Analyzing AI search readiness...", 90);

    private final String key;
    private final String label;
    private final double defaultWeight;
    private final String progressLabel;
    private final int progressPercent;

    Category(String key, String label, double defaultWeight, String progressLabel, int progressPercent) {
        this.key = key;
        this.label = label;
        this.defaultWeight = defaultWeight;
        this.progressLabel = progressLabel;
        this.progressPercent = progressPercent;
    }

    @JsonValue
    public String key() { return key; }
    public String label() { return label; }
    public double defaultWeight() { return defaultWeight; }
    public String progressLabel() { return progressLabel; }
    /** 분석 단계 진행률, 선언 순서대로 증가 */
    public int progressPercent() { return progressPercent; }

    /** YAML/JSON 키 → enum. 대소문자 무시, 없으면 IllegalArgumentException */
    public static Category fromKey(String key) {
        if (key != null) {
            for (Category c : values()) {
                if (c.key.equalsIgnoreCase(key.trim())) return c;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + key);
    }
}
