package com.webauditai.core.config;

import com.webauditai.core.model.Severity;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 분석기 규칙 테이블(크롤러 로스터, 스키마 타입 표, 보안 헤더 등).
 * 클래스패스 rule-tables.yml 에서 한 번 읽고 이후 불변.
 */
public final class RuleTables {

    public static final String RESOURCE = "/rule-tables.yml";

    public record SecurityHeader(String name, int points, Severity severity) {}

    private final List<SecurityHeader> securityHeaders;
    private final Map<String, String> technicalCrawlers;      // UA → 운영사
    private final List<String> aiCrawlers;
    private final List<String> keyAiCrawlers;
    private final Map<String, String> deprecatedSchemaTypes;  // 타입 → 폐기 시점
    private final Map<String, String> restrictedSchemaTypes;  // 타입 → 제한 사유
    private final Map<String, List<String>> requiredSchemaProperties;
    private final List<String> cdnHeaders;
    private final List<String> webFontHosts;

    private RuleTables(Map<?, ?> root) {
        List<SecurityHeader> sh = new ArrayList<>();
        for (Object o : list(root, "securityHeaders")) {
            Map<?, ?> m = (Map<?, ?>) o;
            sh.add(new SecurityHeader(
                    String.valueOf(m.get("name")),
                    ((Number) m.get("points")).intValue(),
                    Severity.fromKey(String.valueOf(m.get("severity")))));
        }
        this.securityHeaders = List.copyOf(sh);
        this.technicalCrawlers = stringMap(root, "technicalCrawlers");
        this.aiCrawlers = stringList(root, "aiCrawlers");
        this.keyAiCrawlers = stringList(root, "keyAiCrawlers");
        this.deprecatedSchemaTypes = stringMap(root, "deprecatedSchemaTypes");
        this.restrictedSchemaTypes = stringMap(root, "restrictedSchemaTypes");

        Map<String, List<String>> req = new LinkedHashMap<>();
        Object rp = root.get("requiredSchemaProperties");
        if (rp instanceof Map<?, ?> m) {
            m.forEach((k, v) -> req.put(String.valueOf(k), toStrings(v)));
        }
        this.requiredSchemaProperties = Collections.unmodifiableMap(req);
        this.cdnHeaders = stringList(root, "cdnHeaders");
        this.webFontHosts = stringList(root, "webFontHosts");
    }

    private static final class Holder {
        static final RuleTables DEFAULTS = load();
    }

    /** 프로세스 전역 기본 테이블(지연 1회 로드) */
    public static RuleTables defaults() { return Holder.DEFAULTS; }

    static RuleTables load() {
        try (InputStream in = RuleTables.class.getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException("classpath resource missing: " + RESOURCE);
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            if (!(root instanceof Map<?, ?> map)) throw new IllegalStateException(RESOURCE + " is not a mapping");
            return new RuleTables(map);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + RESOURCE, e);
        }
    }

    public List<SecurityHeader> securityHeaders() { return securityHeaders; }
    public Map<String, String> technicalCrawlers() { return technicalCrawlers; }
    public List<String> aiCrawlers() { return aiCrawlers; }
    public List<String> keyAiCrawlers() { return keyAiCrawlers; }
    public Map<String, String> deprecatedSchemaTypes() { return deprecatedSchemaTypes; }
    public Map<String, String> restrictedSchemaTypes() { return restrictedSchemaTypes; }
    public Map<String, List<String>> requiredSchemaProperties() { return requiredSchemaProperties; }
    public List<String> cdnHeaders() { return cdnHeaders; }
    public List<String> webFontHosts() { return webFontHosts; }

    // ------------ helpers ------------
    private static List<?> list(Map<?, ?> root, String key) {
        Object v = root.get(key);
        return (v instanceof List<?> l) ? l : List.of();
    }

    private static List<String> stringList(Map<?, ?> root, String key) {
        return toStrings(root.get(key));
    }

    private static List<String> toStrings(Object v) {
        if (!(v instanceof List<?> l)) return List.of();
        List<String> out = new ArrayList<>(l.size());
        for (Object o : l) if (o != null) out.add(String.valueOf(o));
        return List.copyOf(out);
    }

    private static Map<String, String> stringMap(Map<?, ?> root, String key) {
        Map<String, String> out = new LinkedHashMap<>();
        Object v = root.get(key);
        if (v instanceof Map<?, ?> m) m.forEach((k, val) -> out.put(String.valueOf(k), String.valueOf(val)));
        return Collections.unmodifiableMap(out);
    }
}
