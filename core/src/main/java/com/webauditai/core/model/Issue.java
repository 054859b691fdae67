package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 단일 탐지 이슈. 점수 차감량은 담지 않는다(IssueLedger가 별도로 관리).
 * id는 한 분석기 실행 안에서 유일하다고 기대하지만 강제하지 않는다.
 */
@JsonPropertyOrder({"id", "category", "severity", "title", "description", "recommendation", "impact"})
public final class Issue {
    private final String id;
    private final Category category;
    private final Severity severity;
    private final String title;
    private final String description;
    private final String recommendation;
    private final String impact;

    private Issue(Builder b) {
        this.id = b.id;
        this.category = b.category;
        this.severity = b.severity;
        this.title = b.title;
        this.description = b.description == null ? "" : b.description;
        this.recommendation = b.recommendation == null ? "" : b.recommendation;
        this.impact = b.impact == null ? "" : b.impact;
    }

    public String getId() { return id; }
    public Category getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getRecommendation() { return recommendation; }
    public String getImpact() { return impact; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Issue other)) return false;
        return id.equals(other.id)
                && category == other.category
                && severity == other.severity
                && title.equals(other.title)
                && description.equals(other.description)
                && recommendation.equals(other.recommendation)
                && impact.equals(other.impact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category, severity, title, description, recommendation, impact);
    }

    @Override
    public String toString() {
        return "Issue{" + id + ", " + category.key() + ", " + severity.key() + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private Category category;
        private Severity severity;
        private String title;
        private String description;
        private String recommendation;
        private String impact;

        public Builder id(String id) { this.id = id; return this; }
        public Builder category(Category category) { this.category = category; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder recommendation(String recommendation) { this.recommendation = recommendation; return this; }
        public Builder impact(String impact) { this.impact = impact; return this; }

        public Issue build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(title, "title");
            return new Issue(this);
        }
    }
}
