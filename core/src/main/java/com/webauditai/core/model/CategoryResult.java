package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/** 분석기 1회 실행 결과. score ∈ [0,100], weight ∈ (0,1]. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "label", "score", "weight", "issues", "summary",
        "eeat", "geoDetails", "competitorComparison"})
public final class CategoryResult {
    private final Category category;
    private final int score;
    private final double weight;
    private final List<Issue> issues;
    private final String summary;

    // 카테고리별 부가 정보(nullable)
    private final JsonNode eeat;
    private final GeoDetails geoDetails;
    private final CompetitorComparison competitorComparison;

    private CategoryResult(Builder b) {
        this.category = b.category;
        this.score = Math.max(0, Math.min(100, b.score));
        this.weight = b.weight;
        this.issues = List.copyOf(b.issues);
        this.summary = (b.summary == null ? "" : b.summary);
        this.eeat = b.eeat;
        this.geoDetails = b.geoDetails;
        this.competitorComparison = b.competitorComparison;
    }

    @JsonIgnore
    public Category getCategory() { return category; }
    public String getName() { return category.key(); }
    public String getLabel() { return category.label(); }
    public int getScore() { return score; }
    public double getWeight() { return weight; }
    public List<Issue> getIssues() { return issues; }
    public String getSummary() { return summary; }
    public JsonNode getEeat() { return eeat; }
    public GeoDetails getGeoDetails() { return geoDetails; }
    public CompetitorComparison getCompetitorComparison() { return competitorComparison; }

    public static Builder builder(Category category) { return new Builder(category); }

    public static final class Builder {
        private final Category category;
        private int score = 100;
        private double weight;
        private List<Issue> issues = List.of();
        private String summary;
        private JsonNode eeat;
        private GeoDetails geoDetails;
        private CompetitorComparison competitorComparison;

        private Builder(Category category) {
            this.category = Objects.requireNonNull(category, "category");
            this.weight = category.defaultWeight();
        }

        public Builder score(int score) { this.score = score; return this; }
        public Builder weight(double weight) { this.weight = weight; return this; }
        public Builder issues(List<Issue> issues) { this.issues = (issues == null ? List.of() : issues); return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder eeat(JsonNode eeat) { this.eeat = eeat; return this; }
        public Builder geoDetails(GeoDetails geoDetails) { this.geoDetails = geoDetails; return this; }
        public Builder competitorComparison(CompetitorComparison c) { this.competitorComparison = c; return this; }

        public CategoryResult build() {
            if (!(weight > 0)) throw new IllegalArgumentException("weight must be > 0: " + weight);
            return new CategoryResult(this);
        }
    }
}
