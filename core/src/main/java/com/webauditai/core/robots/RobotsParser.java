package com.webauditai.core.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 그룹 파서
 * - 지원 지시어: User-agent / Allow / Disallow (키 대소문자 무시), 나머지는 그룹만 끊는다
 * - 연속된 User-agent 라인은 "같은 그룹", 그 뒤 Allow/Disallow 누적
 * - UA 저장: 소문자, 같은 UA 가 여러 그룹에 나오면 규칙 병합
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    public static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";
        // BOM 이 남아 있으면 첫 줄 키 매칭이 깨진다
        if (robotsTxt.startsWith("\uFEFF")) robotsTxt = robotsTxt.substring(1);

        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        List<String> currentAgents = new ArrayList<>();
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                    if (!lastWasUA) currentAgents = new ArrayList<>();
                    currentAgents.add(ua);
                    byUa.putIfAbsent(ua, new RobotsRules());
                    lastWasUA = true;
                }
                case "allow" -> {
                    // UA 선언 전 규칙은 소속 그룹이 없으므로 버린다
                    for (String ua : currentAgents) byUa.get(ua).addAllow(val);
                    lastWasUA = false;
                }
                case "disallow" -> {
                    for (String ua : currentAgents) byUa.get(ua).addDisallow(val);
                    lastWasUA = false;
                }
                default -> lastWasUA = false;
            }
        }
        return new ParsedRobots(byUa);
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** UA(소문자) → 규칙 */
    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        /** UA 정확 일치(대소문자 무시). 없으면 null */
        public RobotsRules groupFor(String userAgent) {
            if (userAgent == null) return null;
            return byUa.get(userAgent.toLowerCase(Locale.ROOT));
        }

        /** 해당 UA 전용 그룹이 사이트 전체를 막는지("*" 폴백 없음) */
        public boolean agentBlocksSite(String userAgent) {
            RobotsRules r = groupFor(userAgent);
            return r != null && r.blocksSite();
        }

        /** "User-agent: *" 그룹이 "Disallow: /" 로 전체 차단 */
        public boolean wildcardBlocksSite() {
            return agentBlocksSite(UA_ALL);
        }
    }
}
