package com.webauditai.core.scoring;

import com.webauditai.core.model.AuditResult;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.Issue;
import com.webauditai.core.util.UrlUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 7개 CategoryResult → AuditResult.
 *  - overall = rint(Σ score·weight / Σ weight), 가중치 합 0 이면 0
 *  - topFixes = 전체 이슈를 (심각도, 카테고리 가중치 desc) 로 안정 정렬 후 상위 10개
 */
public final class ScoreAggregator {

    public static final int TOP_FIXES_LIMIT = 10;

    public AuditResult aggregate(List<CategoryResult> categories, String finalUrl, String pageTitle,
                                 String metaDescription, Instant fetchedAt, long durationMs) {
        return AuditResult.builder()
                .overallScore(overallScore(categories))
                .categories(categories)
                .topFixes(topFixes(categories, TOP_FIXES_LIMIT))
                .url(finalUrl)
                .domain(UrlUtils.displayDomain(finalUrl))
                .fetchedAt(fetchedAt)
                .auditDurationMs(durationMs)
                .pageTitle(pageTitle)
                .metaDescription(metaDescription)
                .build();
    }

    /** 가중 평균. 실제 가중치 합으로 나눈다(합이 1.00 이 아니어도 동작). */
    public static int overallScore(List<CategoryResult> categories) {
        double totalWeight = 0.0;
        double weighted = 0.0;
        for (CategoryResult c : categories) {
            totalWeight += c.getWeight();
            weighted += c.getScore() * c.getWeight();
        }
        if (totalWeight <= 0.0) return 0;
        return (int) Math.rint(weighted / totalWeight);
    }

    /** List.sort 는 안정 정렬이므로 동률에서는 탐지 순서가 유지된다. */
    public static List<Issue> topFixes(List<CategoryResult> categories, int limit) {
        Map<Category, Double> weightOf = new EnumMap<>(Category.class);
        List<Issue> pool = new ArrayList<>();
        for (CategoryResult c : categories) {
            weightOf.putIfAbsent(c.getCategory(), c.getWeight());
            pool.addAll(c.getIssues());
        }
        pool.sort(Comparator
                .comparingInt((Issue i) -> i.getSeverity().rank())
                .thenComparing((Issue i) -> weightOf.getOrDefault(i.getCategory(), 0.0), Comparator.reverseOrder()));
        return pool.size() <= limit ? pool : new ArrayList<>(pool.subList(0, limit));
    }
}
