package com.webauditai.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webauditai.core.api.IPageParser;
import com.webauditai.core.model.ParsedPage;
import com.webauditai.core.util.TextMetrics;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * jsoup 기반 HTML → ParsedPage.
 * 깨진 마크업도 관대하게 파싱하고, JSON-LD 파싱 실패 블록은 건너뛴다.
 */
public class JsoupPageParser implements IPageParser {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupPageParser.class);

    public static final int BODY_TEXT_LIMIT = 15_000;
    public static final int ANCHOR_TEXT_LIMIT = 100;

    /** 본문 텍스트 추출 전에 제거하는 요소 */
    static final String NON_CONTENT = "script, style, nav, footer, header, noscript";

    private static final Pattern AUTHORITY = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://([^/?#]*)");
    private static final String LD_JSON = "application/ld+json";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public ParsedPage parse(String html, String baseUrl) {
        String base = (baseUrl == null) ? "" : baseUrl;
        Document doc = Jsoup.parse(html == null ? "" : html, base);
        ParsedPage.Builder b = ParsedPage.builder();

        Element htmlTag = doc.selectFirst("html");
        if (htmlTag != null && htmlTag.hasAttr("lang")) b.language(htmlTag.attr("lang"));

        Element title = doc.selectFirst("title");
        if (title != null) b.title(title.text().strip());

        meta(doc, b);
        links(doc, b, base);

        for (int level = 1; level <= 6; level++) {
            for (Element h : doc.select("h" + level)) {
                String text = h.text().strip();
                if (!text.isEmpty()) b.heading(level, text);
            }
        }

        for (Element img : doc.select("img")) {
            String src = img.attr("src");
            if (!base.isEmpty() && !src.isEmpty()) {
                String abs = img.absUrl("src");
                if (!abs.isEmpty()) src = abs;
            }
            b.image(new ParsedPage.ImageInfo(
                    src,
                    attrOrNull(img, "alt"),
                    attrOrNull(img, "width"),
                    attrOrNull(img, "height"),
                    attrOrNull(img, "loading"),
                    attrOrNull(img, "fetchpriority"),
                    attrOrNull(img, "decoding")));
        }

        for (Element s : doc.select("script")) {
            if (LD_JSON.equalsIgnoreCase(s.attr("type").strip())) {
                structuredData(s, b);
                continue;
            }
            if (!s.hasAttr("src") || s.attr("src").isEmpty()) continue;
            b.script(new ParsedPage.ScriptInfo(
                    absOrRaw(s, "src", base),
                    s.hasAttr("async"),
                    s.hasAttr("defer"),
                    attrOrNull(s, "type")));
        }

        for (Element v : doc.select("video")) {
            String src = v.hasAttr("src") ? absOrRaw(v, "src", base) : null;
            if (src == null) {
                Element source = v.selectFirst("source[src]");
                if (source != null) src = absOrRaw(source, "src", base);
            }
            b.video(new ParsedPage.VideoInfo(src, "video"));
        }
        for (Element f : doc.select("iframe[src]")) {
            String src = f.attr("src");
            String kind = embedKind(src);
            if (kind != null) b.video(new ParsedPage.VideoInfo(absOrRaw(f, "src", base), kind));
        }

        b.unorderedLists(doc.select("ul").size());
        b.orderedLists(doc.select("ol").size());

        text(doc, b);
        return b.build();
    }

    private static void meta(Document doc, ParsedPage.Builder b) {
        for (Element m : doc.select("meta")) {
            String name = m.attr("name").toLowerCase(Locale.ROOT);
            String prop = m.attr("property").toLowerCase(Locale.ROOT);
            String content = m.attr("content");

            if (!m.attr("charset").isEmpty()) b.charset(m.attr("charset"));
            switch (name) {
                case "description" -> b.metaDescription(content);
                case "robots" -> b.metaRobots(content);
                case "viewport" -> b.viewport(content);
                default -> { }
            }
            if (prop.startsWith("og:")) b.openGraph(prop, content);
            if (name.startsWith("twitter:")) b.twitterCard(name, content);
        }
    }

    private static void links(Document doc, ParsedPage.Builder b, String base) {
        boolean canonicalSeen = false;
        for (Element l : doc.select("link[rel]")) {
            List<String> rel = relTokens(l);
            if (!canonicalSeen && rel.contains("canonical")) {
                b.canonical(attrOrNull(l, "href"));
                canonicalSeen = true;
            }
            if (rel.contains("alternate") && !l.attr("hreflang").isEmpty()) {
                b.hreflang(new ParsedPage.Hreflang(l.attr("hreflang"), attrOrNull(l, "href")));
            }
            if (rel.contains("stylesheet") && !l.attr("href").isEmpty()) {
                b.stylesheet(absOrRaw(l, "href", base));
            }
        }

        // 기준 URL 이 없으면 내부/외부 구분 불가
        if (base.isEmpty()) return;
        String baseAuthority = authorityOf(base);

        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (href.isEmpty() || href.startsWith("#") || href.startsWith("javascript:")) continue;
            String full = a.absUrl("href");
            if (full.isEmpty()) full = href;

            String text = a.text().strip();
            if (text.length() > ANCHOR_TEXT_LIMIT) text = text.substring(0, ANCHOR_TEXT_LIMIT);
            List<String> rel = relTokens(a);
            ParsedPage.LinkInfo link = new ParsedPage.LinkInfo(full, text, rel, rel.contains("nofollow"));

            String auth = authorityOf(full);
            if (baseAuthority != null && baseAuthority.equalsIgnoreCase(auth)) b.internalLink(link);
            else b.externalLink(link);
        }
    }

    private void structuredData(Element script, ParsedPage.Builder b) {
        String json = script.data();
        if (json == null || json.isBlank()) return;
        try {
            JsonNode node = mapper.readTree(json);
            if (node != null && !node.isMissingNode()) b.structuredData(node);
        } catch (JsonProcessingException e) {
            LOG.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
        }
    }

    /** 제거 대상 요소를 뺀 사본에서 본문/문단/단어 수 */
    private static void text(Document doc, ParsedPage.Builder b) {
        Document clean = doc.clone();
        clean.select(NON_CONTENT).remove();

        for (Element p : clean.select("p")) {
            String t = p.text().strip();
            if (!t.isEmpty()) b.paragraph(t);
        }

        String body = clean.text().strip();
        b.wordCount(TextMetrics.wordCount(body));
        b.bodyText(body.length() > BODY_TEXT_LIMIT ? body.substring(0, BODY_TEXT_LIMIT) : body);
    }

    // ------------ helpers ------------
    private static String attrOrNull(Element e, String key) {
        return e.hasAttr(key) ? e.attr(key) : null;
    }

    private static String absOrRaw(Element e, String key, String base) {
        String raw = e.attr(key);
        if (base.isEmpty() || raw.isEmpty()) return raw;
        String abs = e.absUrl(key);
        return abs.isEmpty() ? raw : abs;
    }

    private static List<String> relTokens(Element e) {
        String rel = e.attr("rel").strip().toLowerCase(Locale.ROOT);
        if (rel.isEmpty()) return List.of();
        return new ArrayList<>(Arrays.asList(rel.split("\\s+")));
    }

    /** scheme://authority 의 authority. 상대/불투명 URL 이면 null */
    static String authorityOf(String url) {
        if (url == null) return null;
        Matcher m = AUTHORITY.matcher(url.strip());
        return m.find() ? m.group(1) : null;
    }

    /** YouTube/Vimeo 임베드면 종류, 아니면 null */
    static String embedKind(String src) {
        String s = src == null ? "" : src.toLowerCase(Locale.ROOT);
        if (s.contains("youtube.com/") || s.contains("youtube-nocookie.com/") || s.contains("youtu.be/")) return "youtube";
        if (s.contains("vimeo.com/")) return "vimeo";
        return null;
    }
}
