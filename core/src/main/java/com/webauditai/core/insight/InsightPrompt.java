package com.webauditai.core.insight;

import java.util.Arrays;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * LLM 평가 프롬프트 종류. 본문은 단어 상한까지 잘라서 넣는다.
 * 템플릿 자리표시자: {url}, {title}, {content}
 */
public enum InsightPrompt {

    /** E-E-A-T 정성 평가 (content 카테고리) */
    EEAT(3000, """
            Analyze this webpage content for E-E-A-T (Experience, Expertise, Authoritativeness, Trustworthiness) quality signals. Return ONLY valid JSON.

            URL: {url}
            Title: {title}
            Content (truncated): {content}

            Return this exact JSON structure:
            {
              "experience": { "score": 0-100, "signals": ["signal1", "signal2"] },
              "expertise": { "score": 0-100, "signals": ["signal1", "signal2"] },
              "authoritativeness": { "score": 0-100, "signals": ["signal1", "signal2"] },
              "trustworthiness": { "score": 0-100, "signals": ["signal1", "signal2"] },
              "overallScore": 0-100,
              "summary": "Brief E-E-A-T assessment",
              "aiContentRisk": "low|medium|high"
            }

            Score each dimension 0-100. Identify specific signals.
            Assess AI content risk based on generic phrasing, lack of specificity,
            and absence of first-hand experience markers.

            Weights: Experience 20%, Expertise 25%, Authoritativeness 25%, Trustworthiness 30%."""),

    /** AI 검색 질의 시뮬레이션 (geo 카테고리, 감점 없음) */
    AI_QUERY_SIMULATION(2000, """
            Analyze this webpage and simulate how AI search engines would use it.

            URL: {url}
            Title: {title}
            Content (truncated): {content}

            Return ONLY valid JSON:
            {
              "simulatedQueries": [
                {"query": "example question a user might ask", "citationLikelihood": "high|medium|low", "reason": "brief reason"},
                {"query": "...", "citationLikelihood": "...", "reason": "..."},
                {"query": "...", "citationLikelihood": "...", "reason": "..."}
              ],
              "topChange": "The single most impactful change to improve AI citation likelihood",
              "aiVisibilityRating": "high|medium|low"
            }

            Generate 3 realistic queries users might ask where this page could be cited. Rate citation likelihood based on content quality, structure, and authority signals.""");

    private static final Pattern SLOT = Pattern.compile("\\{(url|title|content)}");

    private final int maxWords;
    private final String template;

    InsightPrompt(int maxWords, String template) {
        this.maxWords = maxWords;
        this.template = template;
    }

    public int maxWords() { return maxWords; }

    /** 공백 기준 앞 maxWords 단어만 남긴다 */
    public String truncate(String text) {
        if (text == null || text.isBlank()) return "";
        return Arrays.stream(text.trim().split("\\s+"))
                .limit(maxWords)
                .collect(Collectors.joining(" "));
    }

    /** content 는 이미 truncate 된 본문 */
    public String render(String content, String url, String title) {
        Map<String, String> values = Map.of(
                "url", url == null ? "" : url,
                "title", (title == null || title.isBlank()) ? "N/A" : title,
                "content", content == null ? "" : content);
        // 한 번에 치환: 본문 안의 "{url}" 같은 문자열은 다시 치환되지 않음
        Matcher m = SLOT.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + values.get("content").length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(values.get(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
