package com.webauditai.core.util;

/**
 * 감사 진행 콜백. percent 는 호출 순서대로 단조 증가(5 → 100).
 */
@FunctionalInterface
public interface ProgressListener {
    /**
     * @param step    사람이 읽는 단계명 ("Fetching page...", "Complete" 등)
     * @param percent 0~100
     */
    void onProgress(String step, int percent);

    ProgressListener NONE = (step, percent) -> {};
}
