package com.webauditai.core.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.config.RuleTables;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.scoring.IssueLedger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.webauditai.core.model.Severity.HIGH;
import static com.webauditai.core.model.Severity.LOW;
import static com.webauditai.core.model.Severity.MEDIUM;

/**
 * JSON-LD 검사: @context, 폐기/제한 타입, 필수 속성, 기본 스키마 유무.
 * Open Graph 태그가 하나도 없으면 이슈 없이 5점 차감.
 */
public final class StructuredDataAnalyzer implements IAnalyzer {

    static final int NO_OPEN_GRAPH_PENALTY = 5;

    private final double weight;
    private final RuleTables rules;

    public StructuredDataAnalyzer() { this(Category.SCHEMA.defaultWeight(), RuleTables.defaults()); }

    public StructuredDataAnalyzer(double weight, RuleTables rules) {
        this.weight = weight;
        this.rules = rules;
    }

    @Override public Category category() { return Category.SCHEMA; }

    @Override
    public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
        IssueLedger l = new IssueLedger(Category.SCHEMA);
        List<JsonNode> blocks = page.getStructuredData();

        if (blocks.isEmpty()) {
            l.record("schema-none", HIGH, "No structured data found",
                    "No JSON-LD schema markup detected.",
                    "Add JSON-LD schema (Organization, WebSite, BreadcrumbList at minimum). "
                            + "Pages with schema have ~2.5x higher chance in AI answers.",
                    "Missing rich results + AI visibility", 25);
            int score = l.finalScore();
            return result(l, "Schema score: " + score + "/100. No structured data found.");
        }

        Set<String> found = new LinkedHashSet<>();
        for (JsonNode block : blocks) {
            if (block == null || !block.isObject()) continue;
            checkContext(l, block);

            String type = PageSignals.typeOf(block);
            if (type == null) continue;
            found.add(type);
            String slug = type.toLowerCase(Locale.ROOT);

            String deprecatedSince = rules.deprecatedSchemaTypes().get(type);
            if (deprecatedSince != null) {
                l.record("schema-deprecated-" + slug, HIGH, "Deprecated schema type: " + type,
                        type + " was deprecated in " + deprecatedSince + ".",
                        "Remove " + type + " schema. Google no longer supports it.",
                        "No rich results, wasted markup", 10);
            }

            String restriction = rules.restrictedSchemaTypes().get(type);
            if (restriction != null) {
                l.record("schema-restricted-" + slug, MEDIUM, "Restricted schema type: " + type,
                        restriction + ".",
                        "Only use " + type + " if your site qualifies.",
                        "May not generate rich results", 5);
            }

            List<String> required = rules.requiredSchemaProperties().get(type);
            if (required != null) {
                List<String> missing = new ArrayList<>();
                for (String p : required) if (!block.has(p)) missing.add(p);
                if (!missing.isEmpty()) {
                    String joined = String.join(", ", missing);
                    l.record("schema-missing-props-" + slug, MEDIUM, type + " missing required properties",
                            "Missing: " + joined + ".",
                            "Add " + joined + " to your " + type + " schema.",
                            "Incomplete rich results", 5);
                }
            }
        }

        if (!found.contains("Organization") && !found.contains("LocalBusiness")) {
            l.record("schema-no-org", MEDIUM, "No Organization/LocalBusiness schema",
                    "Missing organizational identity schema.",
                    "Add Organization or LocalBusiness schema.",
                    "Missing brand knowledge panel", 5);
        }
        if (!found.contains("BreadcrumbList")) {
            l.record("schema-no-breadcrumb", LOW, "No BreadcrumbList schema",
                    "Breadcrumb navigation not marked up.",
                    "Add BreadcrumbList schema for better SERP display.",
                    "Missing breadcrumb rich results", 3);
        }
        if (!found.contains("WebSite")) {
            l.record("schema-no-website", LOW, "No WebSite schema",
                    "Missing WebSite schema with search action.",
                    "Add WebSite schema for sitelinks searchbox.",
                    "Missing sitelinks searchbox", 3);
        }

        if (page.getOpenGraph().isEmpty()) {
            l.deduct(NO_OPEN_GRAPH_PENALTY);
        }

        int score = l.finalScore();
        String types = found.isEmpty() ? "none" : String.join(", ", found);
        return result(l, "Schema score: " + score + "/100. Found " + blocks.size()
                + " schema blocks (" + types + ").");
    }

    private static void checkContext(IssueLedger l, JsonNode block) {
        JsonNode ctx = block.get("@context");
        if (!PageSignals.truthy(ctx)) {
            l.record("schema-no-context", HIGH, "Schema missing @context",
                    "JSON-LD block has no @context property.",
                    "Add '@context': 'https://schema.org'.", "Invalid schema", 8);
        } else if (ctx.isTextual()) {
            String c = ctx.asText();
            if (c.contains("http://schema.org") && !c.contains("https")) {
                l.record("schema-http-context", MEDIUM, "Schema uses http:// context",
                        "Use https://schema.org instead of http://.",
                        "Change @context to 'https://schema.org'.",
                        "May cause validation warnings", 3);
            }
        }
    }

    private CategoryResult result(IssueLedger l, String summary) {
        return CategoryResult.builder(Category.SCHEMA)
                .score(l.finalScore())
                .weight(weight)
                .issues(l.issues())
                .summary(summary)
                .build();
    }
}
