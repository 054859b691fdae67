package com.webauditai.core.config;

import com.webauditai.core.model.Category;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * audit.yml 을 읽어 AuditConfig 로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 15000
 * userAgent: "Mozilla/5.0 (compatible; WebAuditAI/1.0)"
 * followRedirects: true
 * output:
 *   dir: "out"
 * weights:
 *   technical: 0.20
 *   geo: 0.20
 * insight:
 *   enabled: true
 *   model: "claude-3-5-haiku-latest"
 *   endpoint: "https://api.anthropic.com/v1/messages"
 *   apiKeyEnv: "ANTHROPIC_API_KEY"
 *   maxTokens: 1024
 *   timeoutMs: 30000
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "audit.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 audit.yml, 없으면 기본값 */
    public static AuditConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        if (!Files.exists(p)) {
            AuditConfig cfg = AuditConfig.defaults();
            cfg.validate();
            return cfg;
        }
        return load(p);
    }

    public static AuditConfig load(Path yamlPath) throws IOException {
        if (yamlPath == null || !Files.exists(yamlPath)) {
            throw new IOException("audit.yml not found at: " + (yamlPath == null ? "null" : yamlPath.toAbsolutePath()));
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            AuditConfig cfg = AuditConfig.defaults();
            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
            setString(map, "userAgent", cfg::setUserAgent);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);

            Map<?, ?> output = getMap(map, "output");
            if (output != null) {
                setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            }

            Map<?, ?> weights = getMap(map, "weights");
            if (weights != null) {
                for (var e : weights.entrySet()) {
                    Category c = Category.fromKey(String.valueOf(e.getKey()));
                    cfg.setWeight(c, toDouble(e.getValue(), "weights." + e.getKey()));
                }
            }

            Map<?, ?> insight = getMap(map, "insight");
            if (insight != null) {
                var in2 = cfg.insight();
                setBoolean(insight, "enabled", in2::setEnabled);
                setString(insight, "model", in2::setModel);
                setString(insight, "endpoint", in2::setEndpoint);
                setString(insight, "apiKeyEnv", in2::setApiKeyEnv);
                setString(insight, "apiVersion", in2::setApiVersion);
                setInt(insight, "maxTokens", in2::setMaxTokens);
                setLongAsDurationMs(insight, "timeoutMs", in2::setTimeout);
            }

            cfg.validate();
            return cfg;
        }
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        // 0 이하는 validate() 에서 거부되도록 그대로 전달
        setter.accept(Duration.ofMillis(ms));
    }

    private static double toDouble(Object v, String key) {
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }
}
