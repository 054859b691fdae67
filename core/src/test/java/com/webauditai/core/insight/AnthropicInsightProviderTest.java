package com.webauditai.core.insight;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webauditai.core.config.AuditConfig;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AnthropicInsightProviderTest {

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final String body;
        Resp(int code, String body) { this.code = code; this.body = body; }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://api.anthropic.com/v1/messages"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static String envelope(String text) throws Exception {
        return MAPPER.writeValueAsString(Map.of("content", List.of(Map.of("type", "text", "text", text))));
    }

    private static AuditConfig.InsightCfg cfg() {
        return new AuditConfig().insight().setModel("test-model").setMaxTokens(256);
    }

    @Test
    void sends_messages_request_and_parses_object() throws Exception {
        List<HttpRequest> seen = new ArrayList<>();
        String reply = envelope("{\"overallScore\":72,\"aiContentRisk\":\"low\"}");
        AnthropicInsightProvider p = new AnthropicInsightProvider(cfg(), "sk-test", req -> {
            seen.add(req);
            return new Resp(200, reply);
        });

        Optional<JsonNode> out = p.infer(InsightPrompt.EEAT, "some body text", "https://acme.example/", "Acme");

        assertTrue(out.isPresent());
        assertEquals(72, out.get().get("overallScore").asInt());
        HttpRequest req = seen.get(0);
        assertEquals("POST", req.method());
        assertEquals("sk-test", req.headers().firstValue("x-api-key").orElse(null));
        assertEquals("2023-06-01", req.headers().firstValue("anthropic-version").orElse(null));
        assertEquals("application/json", req.headers().firstValue("content-type").orElse(null));
    }

    @Test
    void request_body_shape() throws Exception {
        AnthropicInsightProvider p = new AnthropicInsightProvider(cfg(), "k", req -> new Resp(200, ""));
        JsonNode body = MAPPER.readTree(p.requestBody("hello"));
        assertEquals("test-model", body.get("model").asText());
        assertEquals(256, body.get("max_tokens").asInt());
        assertEquals("user", body.at("/messages/0/role").asText());
        assertEquals("hello", body.at("/messages/0/content").asText());
    }

    @Test
    void fenced_json_is_unwrapped() throws Exception {
        String reply = envelope("Here you go:\n```json\n{\"aiVisibilityRating\":\"high\"}\n```\nthanks");
        AnthropicInsightProvider p = new AnthropicInsightProvider(cfg(), "k", req -> new Resp(200, reply));

        Optional<JsonNode> out = p.infer(InsightPrompt.AI_QUERY_SIMULATION, "text", "u", "t");
        assertEquals("high", out.orElseThrow().get("aiVisibilityRating").asText());
    }

    @Test
    void unfence_variants() {
        assertEquals("{\"a\":1}", AnthropicInsightProvider.unfence("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", AnthropicInsightProvider.unfence("```\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", AnthropicInsightProvider.unfence("  {\"a\":1}  "));
    }

    @Test
    void non_object_or_malformed_replies_are_empty() throws Exception {
        for (String text : List.of("[1,2,3]", "not json at all", "\"just a string\"")) {
            String reply = envelope(text);
            AnthropicInsightProvider p = new AnthropicInsightProvider(cfg(), "k", req -> new Resp(200, reply));
            assertTrue(p.infer(InsightPrompt.EEAT, "x", "u", "t").isEmpty(), text);
        }
        AnthropicInsightProvider noContent = new AnthropicInsightProvider(cfg(), "k", req -> new Resp(200, "{\"content\":[]}"));
        assertTrue(noContent.infer(InsightPrompt.EEAT, "x", "u", "t").isEmpty());
    }

    @Test
    void non_2xx_is_empty() throws Exception {
        String reply = envelope("{\"overallScore\":90}");
        AnthropicInsightProvider p = new AnthropicInsightProvider(cfg(), "k", req -> new Resp(529, reply));
        assertTrue(p.infer(InsightPrompt.EEAT, "x", "u", "t").isEmpty());
    }

    @Test
    void transport_exception_is_empty() {
        AnthropicInsightProvider p = new AnthropicInsightProvider(cfg(), "k", req -> {
            throw new java.net.http.HttpTimeoutException("request timed out");
        });
        assertTrue(p.infer(InsightPrompt.EEAT, "x", "u", "t").isEmpty());
    }

    @Test
    void missing_key_or_disabled_never_calls_out() {
        AtomicInteger calls = new AtomicInteger();
        AnthropicInsightProvider.HttpSender counting = req -> {
            calls.incrementAndGet();
            return new Resp(200, "");
        };

        AnthropicInsightProvider noKey = new AnthropicInsightProvider(cfg(), " ", counting);
        assertFalse(noKey.isConfigured());
        assertTrue(noKey.infer(InsightPrompt.EEAT, "x", "u", "t").isEmpty());

        AnthropicInsightProvider disabled = new AnthropicInsightProvider(cfg().setEnabled(false), "k", counting);
        assertTrue(disabled.infer(InsightPrompt.EEAT, "x", "u", "t").isEmpty());

        assertEquals(0, calls.get());
    }

    @Test
    void api_key_read_from_configured_env_variable() {
        AuditConfig.InsightCfg c = cfg().setApiKeyEnv("ACME_KEY");
        AnthropicInsightProvider p = new AnthropicInsightProvider(c, name -> "ACME_KEY".equals(name) ? "secret" : null);
        assertTrue(p.isConfigured());
        assertThat(new AnthropicInsightProvider(c, name -> null).isConfigured()).isFalse();
    }
}
