package com.webauditai.core.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.api.IInsightProvider;
import com.webauditai.core.insight.InsightPrompt;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.scoring.IssueLedger;
import com.webauditai.core.util.TextMetrics;

import java.util.Locale;
import java.util.Objects;

import static com.webauditai.core.model.Severity.CRITICAL;
import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/**
 * 콘텐츠 품질: 분량, 가독성(Flesch), H2 구조, 날짜 신호 + 외부 E-E-A-T 평가.
 * provider 가 응답하지 않으면 E-E-A-T 규칙은 건너뛴다.
 */
public final class ContentAnalyzer implements IAnalyzer {

    /** 이보다 짧은 본문은 E-E-A-T 평가를 요청하지 않는다 */
    static final int EEAT_MIN_BODY_CHARS = 100;

    private final double weight;
    private final IInsightProvider insight;

    public ContentAnalyzer(IInsightProvider insight) { this(Category.CONTENT.defaultWeight(), insight); }

    public ContentAnalyzer(double weight, IInsightProvider insight) {
        this.weight = weight;
        this.insight = Objects.requireNonNull(insight, "insight");
    }

    @Override public Category category() { return Category.CONTENT; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        IssueLedger l = new IssueLedger(Category.CONTENT);
        int words = page.getWordCount();
        String body = page.getBodyText();

        if (words < 200) {
            l.record("content-thin", CRITICAL, "Thin content",
                    "Only " + words + " words. Google considers this thin content.",
                    "Add substantial, valuable content (500+ words recommended).",
                    "Major ranking penalty", 20);
        } else if (words < 500) {
            l.record("content-short", HIGH, "Short content",
                    "Page has " + words + " words (recommended: 500+).",
                    "Expand content with valuable information.",
                    "Reduced ranking potential", 12);
        }

        if (!body.isEmpty()) {
            double ease = TextMetrics.fleschReadingEase(body);
            if (ease < 30) {
                l.record("content-hard-read", MEDIUM, "Very difficult to read",
                        "Flesch score: " + fmt(ease) + "/100. Content is hard to understand.",
                        "Simplify language. Target 60-70 for general audiences.",
                        "Poor user engagement", 8);
            } else if (ease < 50) {
                l.record("content-readability", LOW, "Readability could improve",
                        "Flesch score: " + fmt(ease) + "/100.",
                        "Use shorter sentences and simpler words.",
                        "User engagement", 4);
            }
        }

        if (!page.hasHeadings(2) && words > 300) {
            l.record("content-no-h2", MEDIUM, "No H2 headings",
                    "Long content without subheadings.",
                    "Break content into sections with H2 headings.",
                    "Poor readability and SEO structure", 6);
        }

        if (!PageSignals.hasDateSignal(page.getStructuredData()) && words > 500) {
            l.record("content-no-date", LOW, "No publication date signals",
                    "No datePublished or dateModified found.",
                    "Add date metadata via schema markup.",
                    "Content freshness signals missing", 3);
        }

        JsonNode eeat = null;
        if (body.length() > EEAT_MIN_BODY_CHARS) {
            String url = fetch.getFinalUrl();
            eeat = insight.infer(InsightPrompt.EEAT, body, url, page.getTitle()).orElse(null);
        }
        if (eeat != null && eeat.size() > 0) {
            applyEeat(l, eeat);
        }

        int score = l.finalScore();
        return CategoryResult.builder(Category.CONTENT)
                .score(score)
                .weight(weight)
                .issues(l.issues())
                .summary("Content quality score: " + score + "/100. Word count: " + words + ".")
                .eeat(eeat)
                .build();
    }

    private static void applyEeat(IssueLedger l, JsonNode eeat) {
        int overall = eeat.path("overallScore").asInt(50);
        String summary = eeat.path("summary").asText("");
        if (overall < 40) {
            l.record("content-weak-eeat", HIGH, "Weak E-E-A-T signals",
                    "E-E-A-T score: " + overall + "/100. " + summary,
                    "Add author credentials, first-hand experience, citations, and trust signals.",
                    "Major ranking factor since Dec 2025", 15);
        } else if (overall < 60) {
            l.record("content-moderate-eeat", MEDIUM, "Moderate E-E-A-T signals",
                    "E-E-A-T score: " + overall + "/100. " + summary,
                    "Strengthen expertise signals: add author bio, credentials, case studies.",
                    "Competitive ranking disadvantage", 8);
        }

        String risk = eeat.path("aiContentRisk").asText("low");
        if ("high".equals(risk)) {
            l.record("content-ai-risk-high", HIGH, "High AI-generated content risk",
                    "Content shows strong AI-generation patterns.",
                    "Add personal anecdotes, specific data, and first-hand experience.",
                    "Google's helpful content system penalizes generic AI content", 12);
        } else if ("medium".equals(risk)) {
            l.record("content-ai-risk-medium", MEDIUM, "Moderate AI content risk",
                    "Some AI-generation patterns detected.",
                    "Add more specificity and personal expertise signals.",
                    "Potential ranking impact", 6);
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.0f", v);
    }
}
