package com.webauditai.core.scoring;

import com.webauditai.core.model.Category;
import com.webauditai.core.model.Issue;
import com.webauditai.core.model.Severity;
import com.webauditai.core.model.SubScore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class IssueLedgerTest {

    @Test
    void starts_at_100_and_deducts_per_issue() {
        IssueLedger l = new IssueLedger(Category.ONPAGE);
        Issue i = l.record("x-1", Severity.HIGH, "t", "d", "r", "i", 12);

        assertEquals(88, l.finalScore());
        assertEquals(Category.ONPAGE, i.getCategory());
        assertThat(l.issues()).containsExactly(i);
    }

    @Test
    void clamps_at_zero_and_never_recovers() {
        IssueLedger l = new IssueLedger(Category.TECHNICAL);
        l.record("a", Severity.CRITICAL, "t", "d", "r", "i", 70);
        l.record("b", Severity.CRITICAL, "t", "d", "r", "i", 70);
        assertEquals(0, l.finalScore());

        l.record("c", Severity.LOW, "t", "d", "r", "i", 0);
        assertEquals(0, l.finalScore());
        assertEquals(3, l.issueCount());
    }

    @Test
    void informational_issue_costs_nothing() {
        IssueLedger l = new IssueLedger(Category.TECHNICAL);
        l.record("info", Severity.LOW, "t", "d", "r", "i", 0);
        assertEquals(100, l.finalScore());
        assertEquals(1, l.issues().size());
    }

    @Test
    void silent_deduct_adds_no_issue() {
        IssueLedger l = new IssueLedger(Category.SCHEMA);
        l.deduct(5);
        assertEquals(95, l.finalScore());
        assertTrue(l.issues().isEmpty());
    }

    @Test
    void negative_points_rejected() {
        IssueLedger l = new IssueLedger(Category.SCHEMA);
        assertThrows(IllegalArgumentException.class, () -> l.deduct(-1));
    }

    @Test
    void duplicate_ids_are_kept_in_detection_order() {
        IssueLedger l = new IssueLedger(Category.IMAGES);
        l.record("dup", Severity.LOW, "first", "d", "r", "i", 1);
        l.record("dup", Severity.LOW, "second", "d", "r", "i", 1);
        assertThat(l.issues()).extracting(Issue::getTitle).containsExactly("first", "second");
    }

    @Test
    void sub_score_ledger_charges_overall_and_one_bucket() {
        SubScoreLedger l = new SubScoreLedger(Category.GEO);
        l.record(SubScore.CITABILITY, "g1", Severity.HIGH, "t", "d", "r", "i", 10);
        l.record(SubScore.CITABILITY, "g2", Severity.HIGH, "t", "d", "r", "i", 20);
        l.record(SubScore.AUTHORITY, "g3", Severity.LOW, "t", "d", "r", "i", 3);

        assertEquals(67, l.finalScore());
        assertEquals(0, l.subScore(SubScore.CITABILITY));      // 25 - 30 → clamp
        assertEquals(17, l.subScore(SubScore.AUTHORITY));
        assertEquals(20, l.subScore(SubScore.STRUCTURE));
        assertThat(l.subScores()).hasSize(5);
    }
}
