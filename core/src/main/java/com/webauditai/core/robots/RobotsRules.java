package com.webauditai.core.robots;

import java.util.ArrayList;
import java.util.List;

/** 한 User-agent 그룹의 Allow/Disallow 규칙 */
public final class RobotsRules {
    private final List<String> allow = new ArrayList<>();
    private final List<String> disallow = new ArrayList<>();

    RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    RobotsRules addDisallow(String path) {
        // Disallow: (빈값) 은 "전부 허용" 이므로 규칙으로 취급하지 않음
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }

    public List<String> allow() { return List.copyOf(allow); }
    public List<String> disallow() { return List.copyOf(disallow); }

    /** "Disallow: /" 가 있으면 사이트 전체 차단(같은 그룹의 Allow 와 무관) */
    public boolean blocksSite() {
        return disallow.contains("/");
    }
}
