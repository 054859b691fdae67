package com.webauditai.core.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 본문 텍스트 지표: 단어 수, 공백 단어 수, Flesch Reading Ease */
public final class TextMetrics {
    private TextMetrics() {}

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final String VOWELS = "aeiouy";

    /** 텍스트/구문이 없을 때의 중립값 */
    public static final double NEUTRAL_READING_EASE = 60.0;

    /** \b\w+\b 토큰 수 */
    public static int wordCount(String text) {
        if (text == null || text.isEmpty()) return 0;
        Matcher m = WORD.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    /** 공백으로 나눈 토큰 수(문단 길이 판정용) */
    public static int whitespaceWords(String text) {
        if (text == null) return 0;
        String t = text.strip();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }

    /**
     * 206.835 − 1.015·(단어/문장) − 84.6·(음절/단어), [0,100] clamp.
     * 음절은 모음 묶음 휴리스틱(끝 'e' 제외, 최소 1).
     */
    public static double fleschReadingEase(String text) {
        if (text == null) return NEUTRAL_READING_EASE;
        int sentences = 0;
        for (String s : SENTENCE_END.split(text)) {
            if (!s.isBlank()) sentences++;
        }
        Matcher m = WORD.matcher(text);
        int words = 0;
        int syllables = 0;
        while (m.find()) {
            words++;
            syllables += syllables(m.group().toLowerCase(Locale.ROOT));
        }
        if (sentences == 0 || words == 0) return NEUTRAL_READING_EASE;

        double avgSentence = (double) words / sentences;
        double avgSyllables = (double) syllables / words;
        double score = 206.835 - 1.015 * avgSentence - 84.6 * avgSyllables;
        return Math.max(0.0, Math.min(100.0, score));
    }

    static int syllables(String word) {
        int count = 0;
        if (isVowel(word.charAt(0))) count++;
        for (int i = 1; i < word.length(); i++) {
            if (isVowel(word.charAt(i)) && !isVowel(word.charAt(i - 1))) count++;
        }
        if (word.endsWith("e")) count--;
        return count == 0 ? 1 : count;
    }

    private static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }
}
