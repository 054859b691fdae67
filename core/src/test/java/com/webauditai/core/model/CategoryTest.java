package com.webauditai.core.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CategoryTest {

    @Test
    void default_weights_sum_to_one() {
        double sum = Arrays.stream(Category.values()).mapToDouble(Category::defaultWeight).sum();
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    void geo_buckets_sum_to_hundred() {
        assertEquals(100, Arrays.stream(SubScore.values()).mapToInt(SubScore::budget).sum());
    }

    @Test
    void progress_percents_increase_in_declaration_order() {
        int prev = 15;
        for (Category c : Category.values()) {
            assertTrue(c.progressPercent() > prev, c.key());
            prev = c.progressPercent();
        }
        assertTrue(prev < 95);
    }

    @Test
    void from_key_is_case_insensitive() {
        assertEquals(Category.ONPAGE, Category.fromKey(" OnPage "));
        assertThrows(IllegalArgumentException.class, () -> Category.fromKey("links"));
        assertThrows(IllegalArgumentException.class, () -> Category.fromKey(null));
    }

    @Test
    void severity_rank_and_lenient_parse() {
        assertTrue(Severity.CRITICAL.rank() < Severity.LOW.rank());
        assertEquals(Severity.HIGH, Severity.fromKey("High"));
        assertEquals(Severity.LOW, Severity.fromKey("urgent"));
        assertEquals(Severity.LOW, Severity.fromKey(null));
    }

    @Test
    void category_result_clamps_score() {
        CategoryResult r = CategoryResult.builder(Category.IMAGES).score(130).weight(0.05).build();
        assertEquals(100, r.getScore());
        assertEquals("images", r.getName());
        assertEquals("", r.getSummary());
        assertTrue(r.getIssues().isEmpty());
    }
}
