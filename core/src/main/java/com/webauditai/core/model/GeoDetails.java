package com.webauditai.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GEO 카테고리 부가 정보.
 * subScores 키는 SubScore.key(), aiCrawlerStatus 는 로스터 순서 유지.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeoDetails(Map<String, Integer> subScores,
                         Map<String, CrawlerAccess> aiCrawlerStatus,
                         LlmsTxtStatus llmsTxtStatus,
                         int citablePassageCount,
                         JsonNode aiSimulation) {

    public GeoDetails {
        subScores = Collections.unmodifiableMap(new LinkedHashMap<>(subScores));
        aiCrawlerStatus = Collections.unmodifiableMap(new LinkedHashMap<>(aiCrawlerStatus));
    }

    public int subScore(SubScore s) {
        Integer v = subScores.get(s.key());
        return v == null ? 0 : v;
    }

    /** EnumMap → 직렬화용 키 맵(SubScore 선언 순서) */
    public static Map<String, Integer> keyed(Map<SubScore, Integer> byBucket) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (SubScore s : SubScore.values()) {
            Integer v = byBucket.get(s);
            out.put(s.key(), v == null ? 0 : v);
        }
        return out;
    }
}
