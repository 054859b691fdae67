package com.webauditai.core.service;

import com.webauditai.core.analyzer.AnalyzerRegistry;
import com.webauditai.core.api.IAnalyzer;
import com.webauditai.core.api.IInsightProvider;
import com.webauditai.core.api.IPageFetcher;
import com.webauditai.core.api.IPageParser;
import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.config.RuleTables;
import com.webauditai.core.http.PageFetcher;
import com.webauditai.core.insight.AnthropicInsightProvider;
import com.webauditai.core.model.AuditResult;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.PageSnapshot;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.parser.JsoupPageParser;
import com.webauditai.core.scoring.ScoreAggregator;
import com.webauditai.core.util.NamedThreadFactory;
import com.webauditai.core.util.ProgressListener;
import com.webauditai.core.util.StructuredLog;
import com.webauditai.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 감사 오케스트레이터:
 *  - fetch → parse → 7개 분석기 → 집계
 *  - 경쟁 URL 은 본 페이지와 병렬로 fetch, 실패하면 비교 없이 진행
 *  - 본 페이지 fetch 실패/분석기 예외는 error 가 설정된 AuditResult 로 돌려준다(예외 전파 없음)
 */
public final class AuditService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AuditService.class);
    private static final StructuredLog SLOG = StructuredLog.get(AuditService.class);

    static final String STEP_FETCH = "Fetching page...";
    static final String STEP_PARSE = "Parsing HTML...";
    static final String STEP_REPORT = "Generating report...";
    static final String STEP_DONE = "Complete";

    private final IPageFetcher fetcher;
    private final IPageParser parser;
    private final List<IAnalyzer> analyzers;
    private final ScoreAggregator aggregator;
    private final ExecutorService exec;

    /** 기본 구현 */
    public AuditService(AuditConfig config) {
        this(config, new PageFetcher(config), new AnthropicInsightProvider(config.insight()));
    }

    public AuditService(AuditConfig config, IPageFetcher fetcher, IInsightProvider insight) {
        this(fetcher, new JsoupPageParser(),
                AnalyzerRegistry.standard(validated(config), insight, RuleTables.defaults()),
                new ScoreAggregator());
    }

    /** DI/테스트용 */
    public AuditService(IPageFetcher fetcher, IPageParser parser, List<IAnalyzer> analyzers, ScoreAggregator aggregator) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.analyzers = List.copyOf(Objects.requireNonNull(analyzers, "analyzers"));
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.exec = Executors.newSingleThreadExecutor(new NamedThreadFactory("competitor-fetch"));
    }

    private static AuditConfig validated(AuditConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    /* =========================
       실행 API (오버로드 3종)
       ========================= */

    public AuditResult runAudit(String url) {
        return runAudit(url, null, ProgressListener.NONE);
    }

    public AuditResult runAudit(String url, String competitorUrl) {
        return runAudit(url, competitorUrl, ProgressListener.NONE);
    }

    public AuditResult runAudit(String url, String competitorUrl, ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final long t0 = System.nanoTime();
        final Instant fetchedAt = Instant.now();
        final boolean withCompetitor = competitorUrl != null && !competitorUrl.isBlank();

        LOG.info("Audit start: url={}, competitor={}", url, withCompetitor ? competitorUrl : "-");
        SLOG.info("audit-start", "url", url, "competitor", withCompetitor ? competitorUrl : null);

        // ---- 1) fetch (경쟁 URL 은 병렬) ----
        notify(pl, STEP_FETCH, 5);
        CompletableFuture<FetchResult> competitorFetch = withCompetitor
                ? CompletableFuture.supplyAsync(() -> fetcher.fetch(competitorUrl), exec)
                : CompletableFuture.completedFuture(null);

        FetchResult fetch = fetcher.fetch(url);
        if (fetch.hasError()) {
            competitorFetch.cancel(true);
            LOG.warn("Audit aborted, fetch failed: url={}, error={}", url, fetch.getError());
            SLOG.warn("fetch-failed", "url", url, "error", fetch.getError());
            return AuditResult.failure(url != null ? url : fetch.getUrl(), UrlUtils.displayDomain(fetch.getUrl()), fetch.getError(),
                    fetchedAt, elapsedMs(t0));
        }

        // ---- 2) parse ----
        notify(pl, STEP_PARSE, 15);
        ParsedPage page = parser.parse(fetch.getHtml(), fetch.getFinalUrl());
        PageSnapshot competitor = competitorSnapshot(competitorFetch, competitorUrl);

        // ---- 3) analyze ----
        List<CategoryResult> categories = new ArrayList<>(analyzers.size());
        int percent = 15;
        for (IAnalyzer a : analyzers) {
            // 주입된 목록 순서가 달라도 진행률은 줄지 않게
            percent = Math.max(percent, a.category().progressPercent());
            notify(pl, a.category().progressLabel(), percent);
            long a0 = System.nanoTime();
            try {
                CategoryResult r = a.analyze(page, fetch, competitor);
                categories.add(r);
                SLOG.debug("analyzer-done",
                        "category", a.category().key(),
                        "score", r.getScore(),
                        "issues", r.getIssues().size(),
                        "ms", elapsedMs(a0));
            } catch (RuntimeException e) {
                // 분석기는 예외를 던지지 않는 계약: 여기 오면 버그
                LOG.error("Analyzer failed: category={}", a.category().key(), e);
                SLOG.error("analyzer-failed", e, "category", a.category().key());
                return AuditResult.failure(fetch.getFinalUrl(), UrlUtils.displayDomain(fetch.getFinalUrl()),
                        "Audit failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()),
                        fetchedAt, elapsedMs(t0));
            }
        }

        // ---- 4) aggregate ----
        notify(pl, STEP_REPORT, 95);
        AuditResult result = aggregator.aggregate(categories, fetch.getFinalUrl(), page.getTitle(),
                page.getMetaDescription(), fetchedAt, elapsedMs(t0));
        notify(pl, STEP_DONE, 100);

        LOG.info("Audit done: url={}, overall={}, topFixes={}, ms={}",
                result.getUrl(), result.getOverallScore(), result.getTopFixes().size(), result.getAuditDurationMs());
        SLOG.info("audit-done",
                "url", result.getUrl(),
                "overall", result.getOverallScore(),
                "issues", categories.stream().mapToInt(c -> c.getIssues().size()).sum(),
                "ms", result.getAuditDurationMs());
        return result;
    }

    /** 경쟁 페이지는 best-effort: 실패하면 null */
    private PageSnapshot competitorSnapshot(CompletableFuture<FetchResult> future, String competitorUrl) {
        FetchResult cf;
        try {
            cf = future.join();
        } catch (RuntimeException e) {
            LOG.warn("Competitor fetch failed: url={}, cause={}", competitorUrl, e.toString());
            return null;
        }
        if (cf == null) return null;
        if (cf.hasError()) {
            SLOG.warn("competitor-fetch-failed", "url", competitorUrl, "error", cf.getError());
            return null;
        }
        return new PageSnapshot(parser.parse(cf.getHtml(), cf.getFinalUrl()), cf);
    }

    /** 콜백 예외는 감사 흐름에 영향 없음 */
    private static void notify(ProgressListener pl, String step, int percent) {
        try {
            pl.onProgress(step, percent);
        } catch (RuntimeException e) {
            LOG.warn("Progress callback failed at '{}': {}", step, e.toString());
        }
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    @Override
    public void close() {
        exec.shutdownNow();
        try {
            fetcher.close();
        } catch (Exception e) {
            LOG.debug("Fetcher close failed: {}", e.toString());
        }
    }
}
