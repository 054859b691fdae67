package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 감사 1회의 최종 결과. error 가 있으면 점수 0, 카테고리 없음. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"overallScore", "categories", "topFixes", "url", "domain",
        "fetchedAt", "auditDurationMs", "pageTitle", "metaDescription", "error"})
public final class AuditResult {
    private final int overallScore;
    private final List<CategoryResult> categories;
    private final List<Issue> topFixes;
    private final String url;
    private final String domain;
    private final Instant fetchedAt;
    private final long auditDurationMs;
    private final String pageTitle;
    private final String metaDescription;
    private final String error;

    private AuditResult(Builder b) {
        this.overallScore = b.overallScore;
        this.categories = List.copyOf(b.categories);
        this.topFixes = List.copyOf(b.topFixes);
        this.url = b.url;
        this.domain = b.domain;
        this.fetchedAt = (b.fetchedAt == null ? Instant.now() : b.fetchedAt);
        this.auditDurationMs = b.auditDurationMs;
        this.pageTitle = b.pageTitle;
        this.metaDescription = b.metaDescription;
        this.error = b.error;
    }

    public int getOverallScore() { return overallScore; }
    public List<CategoryResult> getCategories() { return categories; }
    public List<Issue> getTopFixes() { return topFixes; }
    public String getUrl() { return url; }
    public String getDomain() { return domain; }
    public Instant getFetchedAt() { return fetchedAt; }
    public long getAuditDurationMs() { return auditDurationMs; }
    public String getPageTitle() { return pageTitle; }
    public String getMetaDescription() { return metaDescription; }
    public String getError() { return error; }

    @JsonIgnore
    public boolean isFailed() { return error != null; }

    /** 1차 fetch 실패 등 치명 오류 결과 */
    public static AuditResult failure(String url, String domain, String error, Instant fetchedAt, long durationMs) {
        return builder()
                .url(url)
                .domain(domain)
                .error(Objects.requireNonNull(error, "error"))
                .fetchedAt(fetchedAt)
                .auditDurationMs(durationMs)
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int overallScore;
        private List<CategoryResult> categories = List.of();
        private List<Issue> topFixes = List.of();
        private String url;
        private String domain;
        private Instant fetchedAt;
        private long auditDurationMs;
        private String pageTitle;
        private String metaDescription;
        private String error;

        public Builder overallScore(int v) { this.overallScore = v; return this; }
        public Builder categories(List<CategoryResult> v) { this.categories = (v == null ? List.of() : v); return this; }
        public Builder topFixes(List<Issue> v) { this.topFixes = (v == null ? List.of() : v); return this; }
        public Builder url(String v) { this.url = v; return this; }
        public Builder domain(String v) { this.domain = v; return this; }
        public Builder fetchedAt(Instant v) { this.fetchedAt = v; return this; }
        public Builder auditDurationMs(long v) { this.auditDurationMs = v; return this; }
        public Builder pageTitle(String v) { this.pageTitle = v; return this; }
        public Builder metaDescription(String v) { this.metaDescription = v; return this; }
        public Builder error(String v) { this.error = v; return this; }

        public AuditResult build() {
            Objects.requireNonNull(url, "url");
            return new AuditResult(this);
        }
    }
}
