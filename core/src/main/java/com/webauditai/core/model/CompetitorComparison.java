package com.webauditai.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 경쟁 페이지 대비 GEO 하위 점수 비교 */
public record CompetitorComparison(String competitorUrl,
                                   int yourScore,
                                   int competitorScore,
                                   Map<String, Integer> yourSubScores,
                                   Map<String, Integer> competitorSubScores,
                                   List<String> advantages,
                                   List<String> gaps,
                                   int competitorIssueCount) {

    /** |delta| 가 이 값 이하면 노이즈로 보고 생략 */
    public static final int NOISE_THRESHOLD = 3;

    public CompetitorComparison {
        yourSubScores = Collections.unmodifiableMap(new LinkedHashMap<>(yourSubScores));
        competitorSubScores = Collections.unmodifiableMap(new LinkedHashMap<>(competitorSubScores));
        advantages = List.copyOf(advantages);
        gaps = List.copyOf(gaps);
    }

    /** 버킷별 delta = ours - theirs. delta > 3 → advantage, delta < -3 → gap */
    public static Diff diff(Map<SubScore, Integer> ours, Map<SubScore, Integer> theirs) {
        List<String> advantages = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        for (SubScore s : SubScore.values()) {
            int delta = ours.getOrDefault(s, 0) - theirs.getOrDefault(s, 0);
            if (delta > NOISE_THRESHOLD) {
                advantages.add(s.label() + " (+" + delta + ")");
            } else if (delta < -NOISE_THRESHOLD) {
                gaps.add(s.label() + " (" + delta + ")");
            }
        }
        return new Diff(List.copyOf(advantages), List.copyOf(gaps));
    }

    public record Diff(List<String> advantages, List<String> gaps) {}
}
