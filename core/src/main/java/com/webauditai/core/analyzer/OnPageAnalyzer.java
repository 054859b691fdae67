package com.webauditai.core.analyzer;

import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.scoring.IssueLedger;
import com.webauditai.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.webauditai.core.model.Severity.CRITICAL;
import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/** 온페이지: 헤딩 구조, 내부 링크, URL 형태, 소셜 태그, lang */
public final class OnPageAnalyzer implements IAnalyzer {

    static final List<String> REQUIRED_OG = List.of("og:title", "og:description", "og:image");

    private final double weight;

    public OnPageAnalyzer() { this(Category.ONPAGE.defaultWeight()); }

    public OnPageAnalyzer(double weight) { this.weight = weight; }

    @Override public Category category() { return Category.ONPAGE; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        IssueLedger l = new IssueLedger(Category.ONPAGE);

        int h1 = page.headings(1).size();
        if (h1 == 0) {
            l.record("onpage-no-h1", CRITICAL, "Missing H1 tag",
                    "No H1 heading found on the page.",
                    "Add a single, descriptive H1 tag.",
                    "Primary on-page ranking signal", 15);
        } else if (h1 > 1) {
            l.record("onpage-multiple-h1", MEDIUM, "Multiple H1 tags",
                    "Found " + h1 + " H1 tags. Use only one per page.",
                    "Keep one H1 and convert others to H2.",
                    "Dilutes heading hierarchy", 6);
        }

        if (page.hasHeadings(3) && !page.hasHeadings(2)) {
            l.record("onpage-skip-h2", MEDIUM, "H3 used without H2",
                    "H3 headings found but no H2. Heading hierarchy is broken.",
                    "Add H2 headings before H3.", "Poor document structure", 5);
        }
        if (page.hasHeadings(4) && !page.hasHeadings(3)) {
            l.record("onpage-skip-h3", LOW, "H4 used without H3",
                    "Heading levels skipped.", "Maintain proper heading hierarchy.",
                    "Minor structure issue", 3);
        }

        int internal = page.getInternalLinks().size();
        if (internal == 0) {
            l.record("onpage-no-internal-links", HIGH, "No internal links",
                    "Page has zero internal links.",
                    "Add 3-5 internal links to related pages.",
                    "Poor crawlability and link equity distribution", 10);
        } else if (internal < 3) {
            l.record("onpage-few-internal-links", MEDIUM, "Few internal links",
                    "Only " + internal + " internal links (recommended: 3-5).",
                    "Add more contextual internal links.",
                    "Suboptimal link equity", 5);
        }

        // URL 구조(최종 URL 의 path)
        String path = UrlUtils.pathOf(fetch.getFinalUrl());
        if (path.length() > 100) {
            l.record("onpage-long-url", LOW, "URL path too long",
                    "Path is " + path.length() + " characters.",
                    "Use shorter, descriptive URLs.", "Hard to share", 3);
        }
        if (!path.equals(path.toLowerCase(Locale.ROOT))) {
            l.record("onpage-uppercase-url", LOW, "URL contains uppercase letters",
                    "URLs should be lowercase to avoid duplicate content.",
                    "Use lowercase URLs.", "Duplicate content risk", 2);
        }
        if (path.contains("_")) {
            l.record("onpage-underscore-url", LOW, "URL uses underscores",
                    "Google treats underscores as word joiners, not separators.",
                    "Use hyphens (-) instead of underscores (_).",
                    "Minor SEO impact", 2);
        }

        Map<String, String> og = page.getOpenGraph();
        List<String> missingOg = new ArrayList<>();
        for (String k : REQUIRED_OG) if (!og.containsKey(k)) missingOg.add(k);
        if (!missingOg.isEmpty()) {
            l.record("onpage-missing-og", MEDIUM, "Incomplete Open Graph tags",
                    "Missing: " + String.join(", ", missingOg) + ".",
                    "Add all Open Graph tags for proper social sharing.",
                    "Poor social sharing appearance", 5);
        }

        if (!page.getTwitterCard().containsKey("twitter:card")) {
            l.record("onpage-no-twitter-card", LOW, "Missing Twitter Card",
                    "No twitter:card meta tag found.",
                    "Add <meta name='twitter:card' content='summary_large_image'>.",
                    "Poor X/Twitter sharing", 3);
        }

        if (PageSignals.isBlank(page.getLanguage())) {
            l.record("onpage-no-lang", MEDIUM, "Missing language attribute",
                    "No lang attribute on <html> tag.",
                    "Add lang='en' (or appropriate language) to the <html> tag.",
                    "Helps search engines determine content language", 4);
        }

        int score = l.finalScore();
        return CategoryResult.builder(Category.ONPAGE)
                .score(score)
                .weight(weight)
                .issues(l.issues())
                .summary("On-page score: " + score + "/100.")
                .build();
    }
}
