package com.webauditai.core.analyzer;

import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.config.RuleTables;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.scoring.IssueLedger;

import java.util.List;
import java.util.Locale;

import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/** 정적 성능 지표: 렌더 블로킹, CSS 수, DOM 추정치, 이미지 포맷/치수, 웹폰트, CDN */
public final class PerformanceAnalyzer implements IAnalyzer {

    static final int DOM_ESTIMATE_LIMIT = 800;

    private final double weight;
    private final RuleTables rules;

    public PerformanceAnalyzer() { this(Category.PERFORMANCE.defaultWeight(), RuleTables.defaults()); }

    public PerformanceAnalyzer(double weight, RuleTables rules) {
        this.weight = weight;
        this.rules = rules;
    }

    @Override public Category category() { return Category.PERFORMANCE; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        IssueLedger l = new IssueLedger(Category.PERFORMANCE);
        List<ParsedPage.ImageInfo> images = page.getImages();

        int blocking = PageSignals.renderBlockingScripts(page);
        if (blocking > 3) {
            l.record("perf-blocking-scripts", HIGH, "Many render-blocking scripts",
                    blocking + " scripts without async/defer.",
                    "Add async or defer to non-critical scripts.",
                    "Delays Largest Contentful Paint", Math.min(15, blocking * 3));
        } else if (blocking > 0) {
            l.record("perf-some-blocking", MEDIUM, "Render-blocking scripts found",
                    blocking + " scripts block rendering.",
                    "Add async or defer attributes.",
                    "Slows initial page load", Math.min(9, blocking * 3));
        }

        int css = page.getStylesheets().size();
        if (css > 5) {
            l.record("perf-many-css", MEDIUM, "Many external stylesheets",
                    css + " external CSS files.",
                    "Combine stylesheets or use critical CSS inlining.",
                    "Increases render-blocking time", 5);
        }

        int dom = images.size() + page.getInternalLinks().size() + page.getExternalLinks().size()
                + page.headingCount() + page.getScripts().size();
        if (dom > DOM_ESTIMATE_LIMIT) {
            l.record("perf-large-dom", MEDIUM, "Large DOM size detected",
                    "Estimated " + dom + "+ elements. Large DOMs slow INP.",
                    "Simplify page structure. Target under 800 key elements.",
                    "Poor Interaction to Next Paint (INP)", 8);
        }

        if (!images.isEmpty()) {
            int legacy = PageSignals.legacyFormatCount(images);
            if (legacy * 2 > images.size()) {
                l.record("perf-old-image-formats", MEDIUM, "Legacy image formats",
                        legacy + "/" + images.size() + " images use JPEG/PNG.",
                        "Convert to WebP or AVIF for 30-50% smaller files.",
                        "Slower page load", 8);
            }
        }

        if (usesWebFonts(page.getStylesheets())) {
            l.record("perf-web-fonts", LOW, "External web fonts detected",
                    "Web fonts add latency.",
                    "Use font-display: swap and preload critical fonts.",
                    "Flash of invisible text", 2);
        }

        int noDims = PageSignals.missingDimensions(images);
        if (noDims > 5) {
            l.record("perf-no-img-dimensions", HIGH, "Images without dimensions",
                    noDims + " images missing width/height.",
                    "Add width and height attributes to all images.",
                    "#1 cause of CLS (Cumulative Layout Shift)", Math.min(12, noDims * 2));
        } else if (noDims > 0) {
            l.record("perf-some-no-dimensions", MEDIUM, "Some images lack dimensions",
                    noDims + " images without width/height.",
                    "Add explicit dimensions to prevent layout shifts.",
                    "Contributes to CLS", Math.min(6, noDims * 2));
        }

        boolean cdn = rules.cdnHeaders().stream().anyMatch(fetch::hasHeader);
        if (!cdn) {
            l.record("perf-no-cdn", LOW, "No CDN detected",
                    "No CDN headers found.",
                    "Use a CDN (Cloudflare, CloudFront, Fastly) for faster delivery.",
                    "Slower load times for distant users", 3);
        }

        int score = l.finalScore();
        return CategoryResult.builder(Category.PERFORMANCE)
                .score(score)
                .weight(weight)
                .issues(l.issues())
                .summary("Performance score: " + score + "/100.")
                .build();
    }

    private boolean usesWebFonts(List<String> stylesheets) {
        for (String sheet : stylesheets) {
            String s = sheet.toLowerCase(Locale.ROOT);
            for (String host : rules.webFontHosts()) {
                if (s.contains(host)) return true;
            }
        }
        return false;
    }
}
