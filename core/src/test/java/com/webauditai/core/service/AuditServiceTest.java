package com.webauditai.core.service;

import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.api.IInsightProvider;
import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.model.AuditResult;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.CrawlerAccess;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.Issue;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.model.Severity;
import com.webauditai.core.parser.JsoupPageParser;
import com.webauditai.core.scoring.ScoreAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditService: fetch → parse → analyzers → aggregate")
class AuditServiceTest {

    private static final String URL = "https://www.acme.example/guide";
    private static final String RIVAL = "https://rival.example/guide";

    /** h1/meta description/JSON-LD 없는 2000 단어 페이지 */
    private static String longPageHtml() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            body.append("<p>");
            for (int w = 0; w < 100; w++) body.append("widget ");
            body.append("</p>");
        }
        return "<html lang=\"en\"><head><title>Widget guide for careful workshop owners</title></head>"
                + "<body><h2>Overview</h2>" + body + "</body></html>";
    }

    private static Issue find(AuditResult r, Category c, String id) {
        return r.getCategories().stream().filter(x -> x.getCategory() == c)
                .flatMap(x -> x.getIssues().stream())
                .filter(i -> i.getId().equals(id))
                .findFirst().orElseThrow(() -> new AssertionError("missing " + id));
    }

    private static CategoryResult category(AuditResult r, Category c) {
        return r.getCategories().stream().filter(x -> x.getCategory() == c).findFirst().orElseThrow();
    }

    private static AuditService service(FakePageFetcher f) {
        return new AuditService(AuditConfig.defaults(), f, IInsightProvider.UNAVAILABLE);
    }

    @Test
    void end_to_end_on_a_long_unstructured_page() {
        FakePageFetcher f = new FakePageFetcher().page(URL, longPageHtml(), "User-agent: *\nDisallow: /\n");

        AuditResult r;
        try (AuditService s = service(f)) {
            r = s.runAudit(URL);
        }

        assertNull(r.getError());
        assertEquals("acme.example", r.getDomain());
        assertEquals("Widget guide for careful workshop owners", r.getPageTitle());
        assertThat(r.getCategories()).extracting(CategoryResult::getCategory).containsExactly(Category.values());

        assertEquals(Severity.CRITICAL, find(r, Category.ONPAGE, "onpage-no-h1").getSeverity());
        assertEquals(Severity.HIGH, find(r, Category.TECHNICAL, "tech-no-meta-desc").getSeverity());
        assertEquals(Severity.HIGH, find(r, Category.SCHEMA, "schema-none").getSeverity());
        assertEquals(Severity.CRITICAL, find(r, Category.GEO, "geo-wildcard-block").getSeverity());

        CategoryResult geo = category(r, Category.GEO);
        assertThat(geo.getGeoDetails().aiCrawlerStatus().values()).hasSize(9).containsOnly(CrawlerAccess.BLOCKED);

        assertEquals(ScoreAggregator.overallScore(r.getCategories()), r.getOverallScore());
        assertThat(r.getOverallScore()).isBetween(0, 100);
        assertThat(r.getTopFixes()).hasSizeLessThanOrEqualTo(10).isNotEmpty();
        assertEquals(Severity.CRITICAL, r.getTopFixes().get(0).getSeverity());
        assertTrue(f.closed);
    }

    @Test
    void fetch_failure_short_circuits() {
        FakePageFetcher f = new FakePageFetcher();
        List<String> steps = new ArrayList<>();

        AuditResult r;
        try (AuditService s = service(f)) {
            r = s.runAudit("https://down.example/", null, (step, pct) -> steps.add(step));
        }

        assertEquals("Connection refused", r.getError());
        assertTrue(r.isFailed());
        assertEquals(0, r.getOverallScore());
        assertThat(r.getCategories()).isEmpty();
        assertThat(r.getTopFixes()).isEmpty();
        assertEquals("https://down.example/", r.getUrl());
        assertThat(steps).containsExactly("Fetching page...");
    }

    @Test
    void progress_is_monotonic_and_labelled() {
        FakePageFetcher f = new FakePageFetcher().page(URL, longPageHtml(), null);
        List<String> steps = new ArrayList<>();
        List<Integer> percents = new ArrayList<>();

        try (AuditService s = service(f)) {
            s.runAudit(URL, null, (step, pct) -> { steps.add(step); percents.add(pct); });
        }

        assertThat(percents).containsExactly(5, 15, 25, 35, 55, 65, 75, 85, 90, 95, 100);
        assertThat(percents).isSorted();
        assertEquals("Analyzing content quality (AI-powered)...", steps.get(3));
        assertEquals("Complete", steps.get(steps.size() - 1));
    }

    @Test
    void progress_never_goes_backwards_for_injected_order() {
        IAnalyzer geo = stub(Category.GEO);
        IAnalyzer tech = stub(Category.TECHNICAL);
        FakePageFetcher f = new FakePageFetcher().page(URL, "<html></html>", null);
        List<Integer> percents = new ArrayList<>();

        try (AuditService s = new AuditService(f, new JsoupPageParser(), List.of(geo, tech), new ScoreAggregator())) {
            s.runAudit(URL, null, (step, pct) -> percents.add(pct));
        }
        assertThat(percents).containsExactly(5, 15, 90, 90, 95, 100);
    }

    private static IAnalyzer stub(Category c) {
        return new IAnalyzer() {
            @Override public Category category() { return c; }
            @Override public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
                return CategoryResult.builder(c).build();
            }
        };
    }

    @Test
    void throwing_callback_does_not_break_audit() {
        FakePageFetcher f = new FakePageFetcher().page(URL, longPageHtml(), null);
        AuditResult r;
        try (AuditService s = service(f)) {
            r = s.runAudit(URL, null, (step, pct) -> { throw new IllegalStateException("ui gone"); });
        }
        assertNull(r.getError());
        assertEquals(7, r.getCategories().size());
    }

    @Test
    void failing_analyzer_turns_into_error_result() {
        IAnalyzer broken = new IAnalyzer() {
            @Override public Category category() { return Category.IMAGES; }
            @Override public CategoryResult analyze(ParsedPage page, FetchResult fetch) {
                throw new IllegalStateException("boom");
            }
        };
        FakePageFetcher f = new FakePageFetcher().page(URL, "<html></html>", null);

        AuditResult r;
        try (AuditService s = new AuditService(f, new JsoupPageParser(), List.of(broken), new ScoreAggregator())) {
            r = s.runAudit(URL);
        }
        assertEquals("Audit failed: boom", r.getError());
        assertThat(r.getCategories()).isEmpty();
        assertEquals(0, r.getOverallScore());
    }

    @Test
    void competitor_is_compared_when_reachable() {
        FakePageFetcher f = new FakePageFetcher()
                .page(URL, longPageHtml(), null)
                .page(RIVAL, "<html><body><p>tiny</p></body></html>", null);

        AuditResult r;
        try (AuditService s = service(f)) {
            r = s.runAudit(URL, RIVAL);
        }

        assertThat(f.requested).containsExactlyInAnyOrder(URL, RIVAL);
        var cmp = category(r, Category.GEO).getCompetitorComparison();
        assertNotNull(cmp);
        assertEquals(RIVAL, cmp.competitorUrl());
        assertEquals(category(r, Category.GEO).getScore(), cmp.yourScore());
        assertNull(category(r, Category.TECHNICAL).getCompetitorComparison());
    }

    @Test
    void unreachable_competitor_is_ignored() {
        FakePageFetcher f = new FakePageFetcher().page(URL, longPageHtml(), null);
        AuditResult r;
        try (AuditService s = service(f)) {
            r = s.runAudit(URL, RIVAL);
        }
        assertNull(r.getError());
        assertNull(category(r, Category.GEO).getCompetitorComparison());
    }

    @Test
    void weights_come_from_config() {
        AuditConfig cfg = AuditConfig.defaults().setWeight(Category.IMAGES, 0.5);
        FakePageFetcher f = new FakePageFetcher().page(URL, longPageHtml(), null);
        AuditResult r;
        try (AuditService s = new AuditService(cfg, f, IInsightProvider.UNAVAILABLE)) {
            r = s.runAudit(URL);
        }
        assertEquals(0.5, category(r, Category.IMAGES).getWeight());
    }

    @Test
    void invalid_config_rejected_up_front() {
        AuditConfig cfg = AuditConfig.defaults().setWeight(Category.GEO, 1.5);
        assertThrows(IllegalArgumentException.class,
                () -> new AuditService(cfg, new FakePageFetcher(), IInsightProvider.UNAVAILABLE));
    }
}
