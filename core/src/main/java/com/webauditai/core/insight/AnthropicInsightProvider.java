package com.webauditai.core.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webauditai.core.api.IInsightProvider;
import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Anthropic Messages API 기반 IInsightProvider.
 * 실패(키 없음, 비 2xx, 타임아웃, JSON object 가 아닌 응답)는 전부 Optional.empty().
 */
public class AnthropicInsightProvider implements IInsightProvider {

    private static final Logger LOG = LoggerFactory.getLogger(AnthropicInsightProvider.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnthropicInsightProvider.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final AuditConfig.InsightCfg cfg;
    private final String apiKey;           // null/blank 면 항상 empty
    private final HttpClient client;       // 프로덕션 경로
    private final HttpSender sender;       // 테스트 경로(있으면 이걸 사용)
    private final ObjectMapper mapper = new ObjectMapper();

    public AnthropicInsightProvider(AuditConfig.InsightCfg cfg) {
        this(cfg, System::getenv);
    }

    /** 환경변수 조회 주입 */
    public AnthropicInsightProvider(AuditConfig.InsightCfg cfg, Function<String, String> env) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.apiKey = env.apply(cfg.getApiKeyEnv());
        this.client = HttpClient.newBuilder()
                .connectTimeout(cfg.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public AnthropicInsightProvider(AuditConfig.InsightCfg cfg, String apiKey, HttpSender testSender) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.apiKey = apiKey;
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    public boolean isConfigured() {
        return cfg.isEnabled() && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Optional<JsonNode> infer(InsightPrompt prompt, String text, String url, String title) {
        if (!isConfigured()) {
            SLOG.debug("insight-unavailable", "prompt", prompt.name(), "reason", "no-api-key");
            return Optional.empty();
        }
        try {
            String body = requestBody(prompt.render(prompt.truncate(text), url, title));
            HttpRequest req = HttpRequest.newBuilder(URI.create(cfg.getEndpoint()))
                    .timeout(cfg.getTimeout())
                    .header("content-type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", cfg.getApiVersion())
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                LOG.warn("Insight request failed: prompt={}, status={}", prompt, status);
                SLOG.warn("insight-unavailable", "prompt", prompt.name(), "status", status);
                return Optional.empty();
            }
            return extract(resp.body());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            SLOG.warn("insight-unavailable", "prompt", prompt.name(), "reason", "interrupted");
            return Optional.empty();
        } catch (Exception e) {
            LOG.warn("Insight request error: prompt={}, cause={}", prompt, e.toString());
            SLOG.warn("insight-unavailable", "prompt", prompt.name(), "reason", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    String requestBody(String promptText) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", cfg.getModel());
        root.put("max_tokens", cfg.getMaxTokens());
        ObjectNode msg = root.putArray("messages").addObject();
        msg.put("role", "user");
        msg.put("content", promptText);
        return mapper.writeValueAsString(root);
    }

    /** 응답의 content[0].text 에서 JSON object 를 꺼낸다 */
    Optional<JsonNode> extract(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) return Optional.empty();
        try {
            JsonNode root = mapper.readTree(responseBody);
            JsonNode textNode = root.path("content").path(0).path("text");
            if (!textNode.isTextual()) return Optional.empty();

            String text = unfence(textNode.asText());
            JsonNode parsed = mapper.readTree(text);
            return (parsed != null && parsed.isObject()) ? Optional.of(parsed) : Optional.empty();
        } catch (JsonProcessingException e) {
            SLOG.warn("insight-unavailable", "reason", "malformed-json");
            return Optional.empty();
        }
    }

    /** ```json ... ``` 펜스 제거 */
    static String unfence(String raw) {
        String text = raw.strip();
        if (text.contains("```")) {
            String[] parts = text.split("```", -1);
            text = parts.length > 1 ? parts[1] : "";
            if (text.startsWith("json")) text = text.substring(4);
            text = text.strip();
        }
        return text;
    }
}
