package com.webauditai.core.robots;

import com.webauditai.core.model.CrawlerAccess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * robots.txt 기준 AI 크롤러별 허용/차단 판정.
 * 와일드카드 전체 차단이 우선: 개별 규칙과 무관하게 모든 크롤러 BLOCKED.
 * robots.txt 가 없으면 전부 ALLOWED.
 */
public final class AiCrawlerPolicy {

    private final RobotsParser.ParsedRobots robots;

    private AiCrawlerPolicy(RobotsParser.ParsedRobots robots) {
        this.robots = robots;
    }

    public static AiCrawlerPolicy of(String robotsTxt) {
        return new AiCrawlerPolicy(RobotsParser.parse(robotsTxt));
    }

    public boolean wildcardBlock() {
        return robots.wildcardBlocksSite();
    }

    /** 크롤러 전용 그룹만 본다(와일드카드 제외) */
    public boolean agentBlocked(String crawler) {
        return robots.agentBlocksSite(crawler);
    }

    public CrawlerAccess access(String crawler) {
        return (wildcardBlock() || agentBlocked(crawler)) ? CrawlerAccess.BLOCKED : CrawlerAccess.ALLOWED;
    }

    /** 로스터 순서를 유지한 상태 맵 */
    public Map<String, CrawlerAccess> statusOf(List<String> roster) {
        Map<String, CrawlerAccess> out = new LinkedHashMap<>();
        for (String c : roster) out.put(c, access(c));
        return Collections.unmodifiableMap(out);
    }

    /** 전용 그룹에서 차단된 크롤러(로스터 순서) */
    public List<String> agentBlocked(List<String> roster) {
        List<String> out = new ArrayList<>();
        for (String c : roster) if (agentBlocked(c)) out.add(c);
        return out;
    }
}
