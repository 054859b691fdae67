package com.webauditai.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 페이지 + 보조 리소스(robots.txt / sitemap.xml / llms.txt) 수집 결과. 생성 후 불변.
 * error가 설정되면 전송 실패이며 나머지 필드는 best-effort.
 */
public final class FetchResult {
    private final String url;
    private final String finalUrl;
    private final int statusCode;          // 응답 없음 = 0
    private final String html;
    private final Map<String, String> headers; // 대소문자 무시
    private final List<String> redirectChain;
    private final String robotsTxt;        // nullable
    private final String sitemapXml;       // nullable
    private final String llmsTxt;          // nullable
    private final String error;            // nullable

    private FetchResult(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null ? b.url : b.finalUrl);
        this.statusCode = b.statusCode;
        this.html = (b.html == null ? "" : b.html);
        TreeMap<String, String> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) {
            b.headers.forEach((k, v) -> { if (k != null && v != null) h.put(k, v); });
        }
        this.headers = Collections.unmodifiableMap(h);
        this.redirectChain = (b.redirectChain == null ? List.of() : List.copyOf(b.redirectChain));
        this.robotsTxt = b.robotsTxt;
        this.sitemapXml = b.sitemapXml;
        this.llmsTxt = b.llmsTxt;
        this.error = b.error;
    }

    public String getUrl() { return url; }
    public String getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public String getHtml() { return html; }
    public Map<String, String> getHeaders() { return headers; }
    public List<String> getRedirectChain() { return redirectChain; }
    public String getRobotsTxt() { return robotsTxt; }
    public String getSitemapXml() { return sitemapXml; }
    public String getLlmsTxt() { return llmsTxt; }
    public String getError() { return error; }

    public boolean hasError() { return error != null; }

    /** 헤더 존재 여부(대소문자 무시) */
    public boolean hasHeader(String name) { return name != null && headers.containsKey(name); }

    /** 헤더 값(대소문자 무시). 없으면 null */
    public String header(String name) { return name == null ? null : headers.get(name); }

    /** 전송 실패 결과 */
    public static FetchResult failed(String url, String error) {
        return builder().url(url).error(error == null ? "Fetch failed" : error).build();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String finalUrl;
        private int statusCode;
        private String html;
        private Map<String, String> headers;
        private List<String> redirectChain;
        private String robotsTxt;
        private String sitemapXml;
        private String llmsTxt;
        private String error;

        public Builder url(String url) { this.url = url; return this; }
        public Builder finalUrl(String finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder html(String html) { this.html = html; return this; }
        public Builder headers(Map<String, String> headers) { this.headers = headers; return this; }
        public Builder redirectChain(List<String> redirectChain) { this.redirectChain = redirectChain; return this; }
        public Builder robotsTxt(String robotsTxt) { this.robotsTxt = robotsTxt; return this; }
        public Builder sitemapXml(String sitemapXml) { this.sitemapXml = sitemapXml; return this; }
        public Builder llmsTxt(String llmsTxt) { this.llmsTxt = llmsTxt; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
