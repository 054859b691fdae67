package com.webauditai.core.http;

import com.webauditai.core.api.IPageFetcher;
import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.util.NamedThreadFactory;
import com.webauditai.core.util.StructuredLog;
import com.webauditai.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 본문 페이지 + origin 의 /robots.txt, /sitemap.xml, /llms.txt 를 동시에 GET.
 * 전송 실패는 예외 대신 FetchResult.error, 보조 리소스는 200 일 때만 채운다.
 */
public class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageFetcher.class);

    static final String ROBOTS_PATH = "/robots.txt";
    static final String SITEMAP_PATH = "/sitemap.xml";
    static final String LLMS_PATH = "/llms.txt";

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final AuditConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final ExecutorService exec;

    public PageFetcher(AuditConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.exec = Executors.newFixedThreadPool(4, new NamedThreadFactory("fetch"));
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .executor(exec)
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public PageFetcher(AuditConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.exec = Executors.newFixedThreadPool(4, new NamedThreadFactory("fetch"));
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(String rawUrl) {
        String url = UrlUtils.withDefaultScheme(rawUrl);
        if (url == null || url.isEmpty()) return FetchResult.failed(String.valueOf(rawUrl), "Invalid URL: empty");

        URI target;
        try {
            target = URI.create(url);
        } catch (IllegalArgumentException e) {
            return FetchResult.failed(url, "Invalid URL: " + e.getMessage());
        }
        String scheme = target.getScheme() == null ? "" : target.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return FetchResult.failed(url, "Invalid URL scheme: " + target.getScheme());
        }
        String origin = UrlUtils.origin(target);
        if (origin == null || target.getHost() == null) {
            return FetchResult.failed(url, "Invalid URL: missing host");
        }

        SLOG.debug("fetch-start", "url", url, "origin", origin);

        CompletableFuture<HttpResponse<String>> main = get(target);
        CompletableFuture<Optional<String>> robots = auxiliary(origin + ROBOTS_PATH);
        CompletableFuture<Optional<String>> sitemap = auxiliary(origin + SITEMAP_PATH);
        CompletableFuture<Optional<String>> llms = auxiliary(origin + LLMS_PATH);

        HttpResponse<String> resp;
        try {
            resp = main.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancelAll(robots, sitemap, llms);
            return FetchResult.failed(url, "Interrupted");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            cancelAll(robots, sitemap, llms);
            LOG.warn("Fetch failed: url={}, cause={}", url, cause.toString());
            SLOG.warn("fetch-failed", "url", url, "error", describe(cause));
            return FetchResult.failed(url, describe(cause));
        }

        FetchResult.Builder b = FetchResult.builder()
                .url(url)
                .finalUrl(resp.uri().toString())
                .statusCode(resp.statusCode())
                .html(resp.body() == null ? "" : resp.body())
                .headers(flattenHeaders(resp.headers().map()))
                .redirectChain(redirectChain(resp));

        b.robotsTxt(robots.join().orElse(null));
        b.sitemapXml(sitemap.join().orElse(null));
        b.llmsTxt(llms.join().orElse(null));

        FetchResult r = b.build();
        LOG.debug("Fetched {} -> {} (status={}, redirects={})",
                url, r.getFinalUrl(), r.getStatusCode(), r.getRedirectChain().size());
        return r;
    }

    private CompletableFuture<HttpResponse<String>> get(URI uri) {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(config.getTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.5")
                .GET()
                .build();
        if (sender != null) {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return sender.send(req);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, exec);
        }
        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 200 이 아니거나 실패하면 empty */
    private CompletableFuture<Optional<String>> auxiliary(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return get(uri).handle((resp, err) -> {
            if (err != null) {
                SLOG.debug("aux-fetch-failed", "url", url, "error", describe(err));
                return Optional.empty();
            }
            if (resp.statusCode() != 200) return Optional.empty();
            return Optional.ofNullable(resp.body());
        });
    }

    /** 다중 값 헤더는 ", " 로 합친다. HTTP/2 의사 헤더(:status 등)는 제외 */
    static Map<String, String> flattenHeaders(Map<String, List<String>> raw) {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null) return out;
        raw.forEach((k, vs) -> {
            if (k == null || k.startsWith(":") || vs == null) return;
            out.put(k.toLowerCase(Locale.ROOT), String.join(", ", vs));
        });
        return out;
    }

    /** 최종 응답 이전의 리다이렉트 응답 URL(오래된 것 먼저) */
    static List<String> redirectChain(HttpResponse<?> resp) {
        List<String> chain = new ArrayList<>();
        Optional<? extends HttpResponse<?>> prev = resp.previousResponse();
        while (prev.isPresent()) {
            HttpResponse<?> p = prev.get();
            chain.add(p.uri().toString());
            prev = p.previousResponse();
        }
        Collections.reverse(chain);
        return chain;
    }

    private static String describe(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        String msg = c.getMessage();
        return (msg == null || msg.isBlank()) ? c.getClass().getSimpleName() : msg;
    }

    @SafeVarargs
    private static void cancelAll(CompletableFuture<Optional<String>>... fs) {
        for (CompletableFuture<Optional<String>> f : fs) f.cancel(true);
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
