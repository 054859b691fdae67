package com.webauditai.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextMetricsTest {

    @Test
    void word_count_uses_word_boundaries() {
        assertEquals(0, TextMetrics.wordCount(null));
        assertEquals(0, TextMetrics.wordCount("  ... !!"));
        assertEquals(6, TextMetrics.wordCount("It's a well-known fact"));   // It, s, a, well, known, fact
        assertEquals(3, TextMetrics.wordCount("café naïve 42"));
    }

    @Test
    void whitespace_words() {
        assertEquals(0, TextMetrics.whitespaceWords("   "));
        assertEquals(3, TextMetrics.whitespaceWords(" well-known  fact,\tok "));
    }

    @Test
    void syllable_heuristic() {
        assertEquals(1, TextMetrics.syllables("the"));
        assertEquals(1, TextMetrics.syllables("cake"));
        assertEquals(2, TextMetrics.syllables("water"));
        assertEquals(1, TextMetrics.syllables("a"));
        assertEquals(3, TextMetrics.syllables("beautiful"));
    }

    @Test
    void reading_ease_is_clamped() {
        assertEquals(100.0, TextMetrics.fleschReadingEase("The cat sat. The dog ran."));
        String dense = "Interdisciplinary organizational communication necessitates comprehensive "
                + "institutional accountability considerations.";
        assertEquals(0.0, TextMetrics.fleschReadingEase(dense));
    }

    @Test
    void reading_ease_neutral_without_text() {
        assertEquals(TextMetrics.NEUTRAL_READING_EASE, TextMetrics.fleschReadingEase(""));
        assertEquals(TextMetrics.NEUTRAL_READING_EASE, TextMetrics.fleschReadingEase("..."));
        assertEquals(TextMetrics.NEUTRAL_READING_EASE, TextMetrics.fleschReadingEase(null));
    }
}
