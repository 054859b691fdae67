package com.webauditai.core.analyzer;

import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.scoring.IssueLedger;

import java.util.List;

import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/** 이미지 최적화: alt, 포맷, 치수, lazy loading, 히어로 이미지 우선순위 */
public final class ImageAnalyzer implements IAnalyzer {

    static final int MIN_ALT_CHARS = 10;

    private final double weight;

    public ImageAnalyzer() { this(Category.IMAGES.defaultWeight()); }

    public ImageAnalyzer(double weight) { this.weight = weight; }

    @Override public Category category() { return Category.IMAGES; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        List<ParsedPage.ImageInfo> images = page.getImages();
        IssueLedger l = new IssueLedger(Category.IMAGES);

        if (images.isEmpty()) {
            return CategoryResult.builder(Category.IMAGES)
                    .score(IssueLedger.START_SCORE)
                    .weight(weight)
                    .summary("No images found on page. Score: 100/100.")
                    .build();
        }
        int total = images.size();

        int noAlt = PageSignals.missingAlt(images);
        if (noAlt > 3) {
            l.record("img-no-alt-many", HIGH, "Many images without alt text",
                    noAlt + "/" + total + " images missing alt text.",
                    "Add descriptive alt text to all non-decorative images.",
                    "Accessibility + image search ranking", Math.min(20, noAlt * 4));
        } else if (noAlt > 0) {
            l.record("img-no-alt-some", MEDIUM, "Some images without alt text",
                    noAlt + " images missing alt text.",
                    "Add alt text describing each image.",
                    "Accessibility issue", Math.min(12, noAlt * 4));
        }

        // 첫 번째 짧은 alt 한 번만
        for (ParsedPage.ImageInfo img : images) {
            if (img.hasAlt() && img.alt().length() < MIN_ALT_CHARS) {
                l.record("img-short-alt", LOW, "Very short alt text",
                        "Alt text '" + img.alt() + "' is too brief.",
                        "Use 10-125 character descriptive alt text.",
                        "Weak image SEO signal", 5);
                break;
            }
        }

        int legacy = PageSignals.legacyFormatCount(images);
        double legacyRatio = (double) legacy / total;
        if (legacyRatio > 0.5) {
            l.record("img-old-formats", MEDIUM, "Legacy image formats",
                    legacy + "/" + total + " images use JPEG/PNG.",
                    "Convert to WebP or AVIF for better compression.",
                    "Slower page load", Math.min(10, (int) Math.rint(legacyRatio * 10)));
        }

        int noDims = PageSignals.missingDimensions(images);
        if (noDims > 5) {
            l.record("img-no-dims-many", HIGH, "Images without dimensions",
                    noDims + " images missing width/height.",
                    "Add width and height attributes.",
                    "Causes Cumulative Layout Shift", Math.min(15, noDims * 2));
        } else if (noDims > 0) {
            l.record("img-no-dims-some", MEDIUM, "Some images lack dimensions",
                    noDims + " images without dimensions.",
                    "Add width/height to prevent layout shifts.",
                    "Contributes to CLS", Math.min(6, noDims * 2));
        }

        // 첫 이미지(히어로)는 제외
        int nonLazy = 0;
        for (ParsedPage.ImageInfo img : images.subList(1, total)) {
            if (!img.isLazy()) nonLazy++;
        }
        if (nonLazy > 3) {
            l.record("img-no-lazy", MEDIUM, "Images not lazy loaded",
                    nonLazy + " below-fold images without loading='lazy'.",
                    "Add loading='lazy' to images below the fold.",
                    "Wasted bandwidth on initial load", Math.min(10, (int) Math.rint(nonLazy / 2.0)));
        }

        ParsedPage.ImageInfo hero = images.get(0);
        if (!"high".equals(hero.fetchPriority()) && !hero.isLazy()) {
            l.record("img-hero-no-priority", LOW, "Hero image not prioritized",
                    "First image doesn't have fetchpriority='high'.",
                    "Add fetchpriority='high' to the hero/LCP image.",
                    "Slower LCP", 3);
        }
        if (hero.isLazy()) {
            l.record("img-hero-lazy", HIGH, "Hero image is lazy loaded",
                    "The first image has loading='lazy' which delays LCP.",
                    "Remove loading='lazy' from the hero image.",
                    "Directly harms Largest Contentful Paint", 10);
        }

        int score = l.finalScore();
        return CategoryResult.builder(Category.IMAGES)
                .score(score)
                .weight(weight)
                .issues(l.issues())
                .summary("Image score: " + score + "/100. " + total + " images analyzed.")
                .build();
    }
}
