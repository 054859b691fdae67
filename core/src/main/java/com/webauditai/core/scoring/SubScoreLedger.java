package com.webauditai.core.scoring;

import com.webauditai.core.model.Category;
import com.webauditai.core.model.Issue;
import com.webauditai.core.model.Severity;
import com.webauditai.core.model.SubScore;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 버킷 귀속 원장. 모든 차감은 전체 점수와 정확히 한 개의 SubScore 에 동시에 반영된다.
 * 전체/버킷 각각 독립적으로 0에서 clamp.
 */
public final class SubScoreLedger {

    private final IssueLedger overall;
    private final EnumMap<SubScore, Integer> buckets = new EnumMap<>(SubScore.class);

    public SubScoreLedger(Category category) {
        this.overall = new IssueLedger(category);
        for (SubScore s : SubScore.values()) buckets.put(s, s.budget());
    }

    public Issue record(SubScore bucket, String id, Severity severity, String title, String description,
                        String recommendation, String impact, int points) {
        Issue issue = overall.record(id, severity, title, description, recommendation, impact, points);
        buckets.merge(bucket, points, (cur, p) -> Math.max(0, cur - p));
        return issue;
    }

    public int finalScore() { return overall.finalScore(); }

    public List<Issue> issues() { return overall.issues(); }

    public int subScore(SubScore s) { return buckets.get(s); }

    /** 사본 반환 */
    public Map<SubScore, Integer> subScores() { return new EnumMap<>(buckets); }
}
