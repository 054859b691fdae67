package com.webauditai.core.analyzer;

import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.config.RuleTables;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.CrawlerAccess;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.robots.AiCrawlerPolicy;
import com.webauditai.core.scoring.IssueLedger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.webauditai.core.analyzer.PageSignals.isBlank;
import static com.webauditai.core.model.Severity.CRITICAL;
import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/** 기술 SEO: title/meta/canonical/robots/viewport/HTTPS/보안 헤더/보조 파일/리다이렉트 */
public final class TechnicalAnalyzer implements IAnalyzer {

    private final double weight;
    private final RuleTables rules;

    public TechnicalAnalyzer() { this(Category.TECHNICAL.defaultWeight(), RuleTables.defaults()); }

    public TechnicalAnalyzer(double weight, RuleTables rules) {
        this.weight = weight;
        this.rules = rules;
    }

    @Override public Category category() { return Category.TECHNICAL; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        IssueLedger l = new IssueLedger(Category.TECHNICAL);

        // Title
        String title = page.getTitle();
        if (isBlank(title)) {
            l.record("tech-no-title", CRITICAL, "Missing title tag",
                    "No <title> tag found.", "Add a descriptive title tag (30-60 chars).",
                    "Major ranking factor", 15);
        } else if (title.length() < 30) {
            l.record("tech-short-title", HIGH, "Title tag too short",
                    "Title is " + title.length() + " chars (min 30).",
                    "Expand title to 30-60 characters.", "Reduced CTR", 8);
        } else if (title.length() > 60) {
            l.record("tech-long-title", MEDIUM, "Title tag too long",
                    "Title is " + title.length() + " chars (max 60). Google will truncate.",
                    "Shorten to under 60 characters.", "Truncated in SERPs", 5);
        }

        // Meta description
        String desc = page.getMetaDescription();
        if (isBlank(desc)) {
            l.record("tech-no-meta-desc", HIGH, "Missing meta description",
                    "No meta description found.",
                    "Add a compelling meta description (120-160 chars).",
                    "Lower CTR from search results", 10);
        } else if (desc.length() < 120) {
            l.record("tech-short-meta-desc", MEDIUM, "Meta description too short",
                    "Meta description is " + desc.length() + " chars (min 120).",
                    "Expand to 120-160 characters.", "Missed CTR opportunity", 5);
        } else if (desc.length() > 160) {
            l.record("tech-long-meta-desc", LOW, "Meta description too long",
                    "Meta description is " + desc.length() + " chars (max 160).",
                    "Shorten to under 160 characters.", "Truncated in SERPs", 3);
        }

        if (isBlank(page.getCanonical())) {
            l.record("tech-no-canonical", HIGH, "Missing canonical tag",
                    "No canonical URL specified.",
                    "Add <link rel='canonical'> to prevent duplicate content.",
                    "Duplicate content risk", 8);
        }

        String robots = page.getMetaRobots() == null ? "" : page.getMetaRobots();
        if (robots.toLowerCase(Locale.ROOT).contains("noindex")) {
            l.record("tech-noindex", CRITICAL, "Page blocked from indexing",
                    "Meta robots contains 'noindex'.",
                    "Remove noindex if this page should appear in search.",
                    "Page invisible to search engines", 20);
        }

        if (isBlank(page.getViewport())) {
            l.record("tech-no-viewport", HIGH, "Missing viewport meta tag",
                    "No viewport meta tag found.",
                    "Add <meta name='viewport' content='width=device-width, initial-scale=1'>.",
                    "Mobile usability issues", 10);
        }

        String finalUrl = fetch.getFinalUrl() == null ? "" : fetch.getFinalUrl();
        if (finalUrl.startsWith("http://")) {
            l.record("tech-no-https", CRITICAL, "Not using HTTPS",
                    "Site is served over HTTP.",
                    "Migrate to HTTPS. It's a confirmed ranking signal.",
                    "Security + ranking penalty", 15);
        }

        for (RuleTables.SecurityHeader h : rules.securityHeaders()) {
            if (!fetch.hasHeader(h.name())) {
                l.record("tech-no-" + h.name(), h.severity(),
                        "Missing " + h.name() + " header",
                        "The " + h.name() + " security header is not set.",
                        "Add " + h.name() + " header for better security.",
                        "Security vulnerability", h.points());
            }
        }

        if (isBlank(fetch.getRobotsTxt())) {
            l.record("tech-no-robots", MEDIUM, "Missing robots.txt",
                    "No robots.txt file found.",
                    "Create a robots.txt to guide crawlers.",
                    "No crawl guidance", 5);
        }

        if (isBlank(fetch.getSitemapXml())) {
            l.record("tech-no-sitemap", MEDIUM, "Missing XML sitemap",
                    "No sitemap.xml found at the root.",
                    "Create and submit an XML sitemap.",
                    "Slower page discovery", 5);
        }

        int hops = fetch.getRedirectChain().size();
        if (hops > 1) {
            l.record("tech-redirect-chain", MEDIUM, "Redirect chain detected",
                    hops + " redirects before reaching the page.",
                    "Reduce to a single redirect.",
                    "Crawl budget waste", 5);
        }

        // AI 크롤러 차단 여부(정보성, 감점 없음)
        AiCrawlerPolicy policy = AiCrawlerPolicy.of(fetch.getRobotsTxt());
        List<String> blocked = new ArrayList<>();
        for (Map.Entry<String, String> e : rules.technicalCrawlers().entrySet()) {
            if (policy.access(e.getKey()) == CrawlerAccess.BLOCKED) {
                blocked.add(e.getKey() + " (" + e.getValue() + ")");
            }
        }
        if (!blocked.isEmpty()) {
            l.record("tech-ai-crawlers-blocked", LOW, "AI crawlers blocked in robots.txt",
                    "Blocked: " + String.join(", ", blocked),
                    "Consider allowing AI crawlers for visibility in AI search.",
                    "Reduced AI search visibility", 0);
        }

        int score = l.finalScore();
        return CategoryResult.builder(Category.TECHNICAL)
                .score(score)
                .weight(weight)
                .issues(l.issues())
                .summary("Technical SEO score: " + score + "/100 with " + l.issueCount() + " issues found.")
                .build();
    }
}
