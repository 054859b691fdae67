package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrawlerAccess {
    ALLOWED, BLOCKED;

    @JsonValue
    public String key() { return this == ALLOWED ? "allowed" : "blocked"; }
}
