package com.webauditai.core.analyzer;

import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.api.IInsightProvider;
import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.config.RuleTables;
import com.webauditai.core.model.Category;

import java.util.List;

/** 7개 분석기 고정 구성. 리스트 순서 = Category 선언 순서 = 실행/출력 순서 */
public final class AnalyzerRegistry {
    private AnalyzerRegistry() {}

    public static List<IAnalyzer> standard(AuditConfig cfg, IInsightProvider insight, RuleTables rules) {
        return List.of(
                new TechnicalAnalyzer(cfg.weightOf(Category.TECHNICAL), rules),
                new ContentAnalyzer(cfg.weightOf(Category.CONTENT), insight),
                new OnPageAnalyzer(cfg.weightOf(Category.ONPAGE)),
                new StructuredDataAnalyzer(cfg.weightOf(Category.SCHEMA), rules),
                new PerformanceAnalyzer(cfg.weightOf(Category.PERFORMANCE), rules),
                new ImageAnalyzer(cfg.weightOf(Category.IMAGES)),
                new AiSearchAnalyzer(cfg.weightOf(Category.GEO), rules, insight));
    }
}
