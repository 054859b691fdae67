package com.webauditai.core.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.model.FetchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PageFetcherTest {

    private HttpServer server;
    private String base;
    private PageFetcher fetcher;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/page", ex -> {
            ex.getResponseHeaders().add("X-Frame-Options", "DENY");
            ex.getResponseHeaders().add("Cache-Control", "no-cache");
            ex.getResponseHeaders().add("Cache-Control", "no-store");
            respond(ex, 200, "<html><title>Hi</title></html>");
        });
        server.createContext("/a", ex -> redirect(ex, "/b"));
        server.createContext("/b", ex -> redirect(ex, "/page"));
        server.createContext("/missing", ex -> respond(ex, 404, "nope"));
        server.createContext("/robots.txt", ex -> respond(ex, 200, "User-agent: *\nDisallow: /private\n"));
        server.createContext("/sitemap.xml", ex -> respond(ex, 404, "not here"));
        server.createContext("/llms.txt", ex -> respond(ex, 500, "boom"));
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        fetcher = new PageFetcher(AuditConfig.defaults().setTimeout(Duration.ofSeconds(5)));
    }

    @AfterEach
    void stop() {
        fetcher.close();
        server.stop(0);
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void redirect(HttpExchange ex, String location) throws IOException {
        ex.getResponseHeaders().add("Location", location);
        ex.sendResponseHeaders(301, -1);
        ex.close();
    }

    @Test
    void fetches_page_and_auxiliary_files() {
        FetchResult r = fetcher.fetch(base + "/page");

        assertNull(r.getError());
        assertEquals(200, r.getStatusCode());
        assertEquals(base + "/page", r.getFinalUrl());
        assertThat(r.getHtml()).contains("<title>Hi</title>");
        assertThat(r.getRedirectChain()).isEmpty();

        assertEquals("DENY", r.header("x-frame-options"));
        assertEquals("no-cache, no-store", r.header("Cache-Control"));

        assertThat(r.getRobotsTxt()).contains("Disallow: /private");
        assertNull(r.getSitemapXml(), "404 sitemap is treated as absent");
        assertNull(r.getLlmsTxt(), "500 llms.txt is treated as absent");
    }

    @Test
    void follows_redirects_and_records_chain_oldest_first() {
        FetchResult r = fetcher.fetch(base + "/a");

        assertEquals(base + "/a", r.getUrl());
        assertEquals(base + "/page", r.getFinalUrl());
        assertThat(r.getRedirectChain()).containsExactly(base + "/a", base + "/b");
    }

    @Test
    void error_status_is_not_a_transport_failure() {
        FetchResult r = fetcher.fetch(base + "/missing");
        assertNull(r.getError());
        assertEquals(404, r.getStatusCode());
        assertEquals("nope", r.getHtml());
    }

    @Test
    void rejects_non_http_scheme() {
        FetchResult r = fetcher.fetch("ftp://acme.example/file");
        assertEquals("Invalid URL scheme: ftp", r.getError());
        assertEquals(0, r.getStatusCode());
    }

    @Test
    void rejects_opaque_schemes_without_sending() {
        List<String> sent = new CopyOnWriteArrayList<>();
        try (PageFetcher recording = new PageFetcher(AuditConfig.defaults(), req -> {
            sent.add(req.uri().toString());
            throw new IOException("should not be sent");
        })) {
            assertEquals("Invalid URL scheme: mailto", recording.fetch("mailto:admin@intranet.local").getError());
            assertEquals("Invalid URL scheme: javascript", recording.fetch("javascript:alert(1)").getError());
            assertEquals("Invalid URL scheme: file", recording.fetch("file:/etc/passwd").getError());
        }
        assertThat(sent).isEmpty();
    }

    @Test
    void rejects_unparsable_url() {
        FetchResult r = fetcher.fetch("http://bad host/");
        assertThat(r.getError()).startsWith("Invalid URL");
    }

    @Test
    void connection_refused_is_reported_not_thrown() throws IOException {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        FetchResult r = fetcher.fetch("http://127.0.0.1:" + port + "/");
        assertTrue(r.hasError());
        assertEquals(0, r.getStatusCode());
        assertEquals("", r.getHtml());
    }

    @Test
    void flatten_headers_drops_pseudo_headers() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put(":status", List.of("200"));
        raw.put("Set-Cookie", List.of("a=1", "b=2"));
        Map<String, String> flat = PageFetcher.flattenHeaders(raw);
        assertThat(flat).containsOnlyKeys("set-cookie");
        assertEquals("a=1, b=2", flat.get("set-cookie"));
    }
}
