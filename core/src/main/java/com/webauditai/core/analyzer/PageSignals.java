package com.webauditai.core.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.webauditai.core.model.ParsedPage;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 여러 분석기가 공유하는 페이지 판정 헬퍼 */
final class PageSignals {
    private PageSignals() {}

    static final Set<String> LEGACY_IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "bmp");

    static boolean isBlank(String s) { return s == null || s.isEmpty(); }

    /** JSON-LD 블록의 @type. 배열이면 첫 원소, 문자열이 아니면 null */
    static String typeOf(JsonNode block) {
        if (block == null || !block.isObject()) return null;
        JsonNode t = block.get("@type");
        if (t == null) return null;
        if (t.isArray()) t = t.size() > 0 ? t.get(0) : null;
        return (t != null && t.isTextual() && !t.asText().isEmpty()) ? t.asText() : null;
    }

    /** null/빈 문자열/false/0/빈 컨테이너가 아니면 true */
    static boolean truthy(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return false;
        if (n.isTextual()) return !n.asText().isEmpty();
        if (n.isBoolean()) return n.asBoolean();
        if (n.isNumber()) return n.asDouble() != 0.0;
        if (n.isContainerNode()) return n.size() > 0;
        return true;
    }

    /** datePublished 또는 dateModified 를 가진 object 블록이 하나라도 있는지 */
    static boolean hasDateSignal(List<JsonNode> blocks) {
        for (JsonNode b : blocks) {
            if (b != null && b.isObject() && (truthy(b.get("datePublished")) || truthy(b.get("dateModified")))) {
                return true;
            }
        }
        return false;
    }

    static boolean hasType(List<JsonNode> blocks, Set<String> types) {
        for (JsonNode b : blocks) {
            String t = typeOf(b);
            if (t != null && types.contains(t)) return true;
        }
        return false;
    }

    /** src 의 마지막 '.' 뒤가 jpg/jpeg/png/gif/bmp 인 이미지 수 */
    static int legacyFormatCount(List<ParsedPage.ImageInfo> images) {
        int n = 0;
        for (ParsedPage.ImageInfo img : images) {
            String src = img.src() == null ? "" : img.src().toLowerCase(Locale.ROOT);
            int dot = src.lastIndexOf('.');
            String ext = dot >= 0 ? src.substring(dot + 1) : "";
            if (LEGACY_IMAGE_EXTENSIONS.contains(ext)) n++;
        }
        return n;
    }

    static int missingDimensions(List<ParsedPage.ImageInfo> images) {
        int n = 0;
        for (ParsedPage.ImageInfo img : images) if (!img.hasDimensions()) n++;
        return n;
    }

    static int missingAlt(List<ParsedPage.ImageInfo> images) {
        int n = 0;
        for (ParsedPage.ImageInfo img : images) if (!img.hasAlt()) n++;
        return n;
    }

    static int renderBlockingScripts(ParsedPage page) {
        int n = 0;
        for (ParsedPage.ScriptInfo s : page.getScripts()) if (s.isRenderBlocking()) n++;
        return n;
    }
}
