package com.webauditai.core.config;

import com.webauditai.core.model.Category;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 감사 설정 (audit.yml 매핑 대상), 순수 설정 보관용.
 * 카테고리 가중치는 기본값(Category.defaultWeight, 합 1.00)에서 시작해 YAML 로 덮어쓴다.
 */
public final class AuditConfig {

    /** YAML `insight:` 섹션: 외부 LLM 평가 */
    public static final class InsightCfg {
        private boolean enabled = true;
        private String endpoint = "https://api.anthropic.com/v1/messages";
        private String model = "claude-3-5-haiku-latest";
        private String apiKeyEnv = "ANTHROPIC_API_KEY";
        private String apiVersion = "2023-06-01";
        private int maxTokens = 1024;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public InsightCfg setEnabled(boolean v) { this.enabled = v; return this; }

        public String getEndpoint() { return endpoint; }
        public InsightCfg setEndpoint(String v) { this.endpoint = v; return this; }

        public String getModel() { return model; }
        public InsightCfg setModel(String v) { this.model = v; return this; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public InsightCfg setApiKeyEnv(String v) { this.apiKeyEnv = v; return this; }

        public String getApiVersion() { return apiVersion; }
        public InsightCfg setApiVersion(String v) { this.apiVersion = v; return this; }

        public int getMaxTokens() { return maxTokens; }
        public InsightCfg setMaxTokens(int v) { this.maxTokens = v; return this; }

        public Duration getTimeout() { return timeout; }
        public InsightCfg setTimeout(Duration v) { this.timeout = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private Duration timeout = Duration.ofSeconds(15);   // 요청별 타임아웃
    private String userAgent = "Mozilla/5.0 (compatible; WebAuditAI/1.0)";
    private boolean followRedirects = true;
    private Path outputDir = Path.of("out");
    private final EnumMap<Category, Double> weights = new EnumMap<>(Category.class);
    private final InsightCfg insight = new InsightCfg();

    public AuditConfig() {
        for (Category c : Category.values()) weights.put(c, c.defaultWeight());
    }

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Path getOutputDir() { return outputDir; }
    public InsightCfg insight() { return insight; }

    public double weightOf(Category c) { return weights.get(c); }
    public Map<Category, Double> getWeights() { return new EnumMap<>(weights); }

    // ---------- fluent setters ----------
    public AuditConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public AuditConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public AuditConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public AuditConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public AuditConfig setWeight(Category c, double w) { weights.put(Objects.requireNonNull(c, "category"), w); return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(outputDir, "outputDir");
        for (var e : weights.entrySet()) {
            double w = e.getValue();
            if (!(w > 0.0) || w > 1.0)
                throw new IllegalArgumentException("weights." + e.getKey().key() + " must be in (0,1]: " + w);
        }
        if (insight.getMaxTokens() < 1)
            throw new IllegalArgumentException("insight.maxTokens must be >= 1");
        if (insight.getTimeout() == null || insight.getTimeout().isNegative() || insight.getTimeout().isZero())
            throw new IllegalArgumentException("insight.timeoutMs must be > 0");
    }

    public static AuditConfig defaults() { return new AuditConfig(); }
}
