package com.webauditai.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTML 파서가 만든 정규화된 문서 사실들. 모든 분석기의 읽기 전용 입력.
 * 누락 필드는 null(단일 값) 또는 빈 컬렉션.
 */
public final class ParsedPage {

    public record ImageInfo(String src, String alt, String width, String height,
                            String loading, String fetchPriority, String decoding) {
        public boolean hasAlt() { return alt != null && !alt.isEmpty(); }
        public boolean hasDimensions() { return notBlank(width) && notBlank(height); }
        public boolean isLazy() { return "lazy".equals(loading); }
    }

    public record LinkInfo(String href, String text, List<String> rel, boolean nofollow) {
        public LinkInfo {
            rel = (rel == null ? List.of() : List.copyOf(rel));
        }
    }

    public record ScriptInfo(String src, boolean async, boolean defer, String type) {
        /** async/defer 둘 다 없으면 렌더 블로킹 */
        public boolean isRenderBlocking() { return !async && !defer; }
    }

    public record Hreflang(String lang, String href) {}

    public record VideoInfo(String src, String kind) {}

    private final String title;
    private final String metaDescription;
    private final String metaRobots;
    private final String viewport;
    private final String canonical;
    private final String language;
    private final String charset;
    private final List<List<String>> headings;       // index 0 = h1 ... 5 = h6
    private final List<JsonNode> structuredData;
    private final List<ImageInfo> images;
    private final List<LinkInfo> internalLinks;
    private final List<LinkInfo> externalLinks;
    private final List<ScriptInfo> scripts;
    private final List<String> stylesheets;
    private final Map<String, String> openGraph;
    private final Map<String, String> twitterCard;
    private final List<Hreflang> hreflang;
    private final List<String> paragraphs;
    private final int unorderedLists;
    private final int orderedLists;
    private final List<VideoInfo> videos;
    private final int wordCount;
    private final String bodyText;

    private ParsedPage(Builder b) {
        this.title = b.title;
        this.metaDescription = b.metaDescription;
        this.metaRobots = b.metaRobots;
        this.viewport = b.viewport;
        this.canonical = b.canonical;
        this.language = b.language;
        this.charset = b.charset;
        List<List<String>> h = new ArrayList<>(6);
        for (int i = 0; i < 6; i++) h.add(List.copyOf(b.headings.get(i)));
        this.headings = Collections.unmodifiableList(h);
        this.structuredData = List.copyOf(b.structuredData);
        this.images = List.copyOf(b.images);
        this.internalLinks = List.copyOf(b.internalLinks);
        this.externalLinks = List.copyOf(b.externalLinks);
        this.scripts = List.copyOf(b.scripts);
        this.stylesheets = List.copyOf(b.stylesheets);
        this.openGraph = Collections.unmodifiableMap(new LinkedHashMap<>(b.openGraph));
        this.twitterCard = Collections.unmodifiableMap(new LinkedHashMap<>(b.twitterCard));
        this.hreflang = List.copyOf(b.hreflang);
        this.paragraphs = List.copyOf(b.paragraphs);
        this.unorderedLists = b.unorderedLists;
        this.orderedLists = b.orderedLists;
        this.videos = List.copyOf(b.videos);
        this.wordCount = b.wordCount;
        this.bodyText = (b.bodyText == null ? "" : b.bodyText);
    }

    public String getTitle() { return title; }
    public String getMetaDescription() { return metaDescription; }
    public String getMetaRobots() { return metaRobots; }
    public String getViewport() { return viewport; }
    public String getCanonical() { return canonical; }
    public String getLanguage() { return language; }
    public String getCharset() { return charset; }
    public List<JsonNode> getStructuredData() { return structuredData; }
    public List<ImageInfo> getImages() { return images; }
    public List<LinkInfo> getInternalLinks() { return internalLinks; }
    public List<LinkInfo> getExternalLinks() { return externalLinks; }
    public List<ScriptInfo> getScripts() { return scripts; }
    public List<String> getStylesheets() { return stylesheets; }
    public Map<String, String> getOpenGraph() { return openGraph; }
    public Map<String, String> getTwitterCard() { return twitterCard; }
    public List<Hreflang> getHreflang() { return hreflang; }
    public List<String> getParagraphs() { return paragraphs; }
    public int getUnorderedLists() { return unorderedLists; }
    public int getOrderedLists() { return orderedLists; }
    public List<VideoInfo> getVideos() { return videos; }
    public int getWordCount() { return wordCount; }
    public String getBodyText() { return bodyText; }

    /** level: 1..6 */
    public List<String> headings(int level) {
        if (level < 1 || level > 6) throw new IllegalArgumentException("heading level: " + level);
        return headings.get(level - 1);
    }

    public boolean hasHeadings(int level) { return !headings(level).isEmpty(); }

    /** h1..h6 전체(레벨 순) */
    public List<String> allHeadings() {
        List<String> out = new ArrayList<>();
        for (List<String> h : headings) out.addAll(h);
        return out;
    }

    public int headingCount() {
        int n = 0;
        for (List<String> h : headings) n += h.size();
        return n;
    }

    private static boolean notBlank(String s) { return s != null && !s.isEmpty(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String title;
        private String metaDescription;
        private String metaRobots;
        private String viewport;
        private String canonical;
        private String language;
        private String charset;
        private final List<List<String>> headings = new ArrayList<>();
        private final List<JsonNode> structuredData = new ArrayList<>();
        private final List<ImageInfo> images = new ArrayList<>();
        private final List<LinkInfo> internalLinks = new ArrayList<>();
        private final List<LinkInfo> externalLinks = new ArrayList<>();
        private final List<ScriptInfo> scripts = new ArrayList<>();
        private final List<String> stylesheets = new ArrayList<>();
        private final Map<String, String> openGraph = new LinkedHashMap<>();
        private final Map<String, String> twitterCard = new LinkedHashMap<>();
        private final List<Hreflang> hreflang = new ArrayList<>();
        private final List<String> paragraphs = new ArrayList<>();
        private int unorderedLists;
        private int orderedLists;
        private final List<VideoInfo> videos = new ArrayList<>();
        private int wordCount;
        private String bodyText;

        private Builder() {
            for (int i = 0; i < 6; i++) headings.add(new ArrayList<>());
        }

        public Builder title(String v) { this.title = v; return this; }
        public Builder metaDescription(String v) { this.metaDescription = v; return this; }
        public Builder metaRobots(String v) { this.metaRobots = v; return this; }
        public Builder viewport(String v) { this.viewport = v; return this; }
        public Builder canonical(String v) { this.canonical = v; return this; }
        public Builder language(String v) { this.language = v; return this; }
        public Builder charset(String v) { this.charset = v; return this; }

        public Builder heading(int level, String text) {
            if (level < 1 || level > 6) throw new IllegalArgumentException("heading level: " + level);
            headings.get(level - 1).add(text);
            return this;
        }

        public Builder structuredData(JsonNode block) { structuredData.add(block); return this; }
        public Builder image(ImageInfo img) { images.add(img); return this; }
        public Builder internalLink(LinkInfo link) { internalLinks.add(link); return this; }
        public Builder externalLink(LinkInfo link) { externalLinks.add(link); return this; }
        public Builder script(ScriptInfo s) { scripts.add(s); return this; }
        public Builder stylesheet(String href) { stylesheets.add(href); return this; }
        public Builder openGraph(String property, String content) { openGraph.put(property, content); return this; }
        public Builder twitterCard(String name, String content) { twitterCard.put(name, content); return this; }
        public Builder hreflang(Hreflang h) { hreflang.add(h); return this; }
        public Builder paragraph(String text) { paragraphs.add(text); return this; }
        public Builder unorderedLists(int n) { this.unorderedLists = n; return this; }
        public Builder orderedLists(int n) { this.orderedLists = n; return this; }
        public Builder video(VideoInfo v) { videos.add(v); return this; }
        public Builder wordCount(int n) { this.wordCount = n; return this; }
        public Builder bodyText(String v) { this.bodyText = v; return this; }

        public ParsedPage build() { return new ParsedPage(this); }
    }
}
