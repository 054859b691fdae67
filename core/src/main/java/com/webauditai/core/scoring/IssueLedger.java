package com.webauditai.core.scoring;

import com.webauditai.core.model.Category;
import com.webauditai.core.model.Issue;
import com.webauditai.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 분석기 1회 실행 동안의 차감/이슈 누적기. 실행마다 새로 만든다.
 * score = max(0, 100 - 누적 차감), 차감할 때마다 즉시 clamp.
 */
public final class IssueLedger {

    public static final int START_SCORE = 100;

    private final Category category;
    private final List<Issue> issues = new ArrayList<>();
    private int score = START_SCORE;

    public IssueLedger(Category category) {
        this.category = Objects.requireNonNull(category, "category");
    }

    /** 이슈를 추가하고 points 만큼 차감. points=0 이면 정보성 이슈. */
    public Issue record(String id, Severity severity, String title, String description,
                        String recommendation, String impact, int points) {
        Issue issue = Issue.builder()
                .id(id)
                .category(category)
                .severity(severity)
                .title(title)
                .description(description)
                .recommendation(recommendation)
                .impact(impact)
                .build();
        issues.add(issue);
        deduct(points);
        return issue;
    }

    /** 이슈 없이 점수만 차감 */
    public void deduct(int points) {
        if (points < 0) throw new IllegalArgumentException("points must be >= 0: " + points);
        score = Math.max(0, score - points);
    }

    public Category category() { return category; }

    public int finalScore() { return score; }

    public List<Issue> issues() { return List.copyOf(issues); }

    public int issueCount() { return issues.size(); }
}
