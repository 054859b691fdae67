package com.webauditai.core.model;

/** AI 검색(GEO) 카테고리의 5개 하위 버킷. budget 합계 = 100. */
public enum SubScore {
    CITABILITY("citability", "Citability", 25),
    STRUCTURE("structure", "Structure", 20),
    MULTI_MODAL("multiModal", "Multi-Modal", 15),
    AUTHORITY("authority", "Authority", 20),
    TECHNICAL("technical", "Technical AI Access", 20);

    private final String key;
    private final String label;
    private final int budget;

    SubScore(String key, String label, int budget) {
        this.key = key;
        this.label = label;
        this.budget = budget;
    }

    public String key() { return key; }
    public String label() { return label; }
    public int budget() { return budget; }
}
