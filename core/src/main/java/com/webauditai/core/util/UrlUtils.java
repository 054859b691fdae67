package com.webauditai.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

/** URL 입력 보정 + origin/도메인 추출 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    // RFC 3986 scheme
    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:");
    // "host:port" 형태(scheme 아님)
    private static final Pattern HOST_PORT = Pattern.compile("^[^:/?#]+:\\d+(?:[/?#].*)?$");

    /**
     * scheme 이 없으면 https:// 를 붙인다("example.com/a" → "https://example.com/a").
     * "mailto:", "file:" 같은 다른 scheme 은 그대로 두어 호출자가 거부하게 한다.
     */
    public static String withDefaultScheme(String url) {
        if (url == null) return null;
        String s = url.trim();
        if (s.isEmpty()) return s;
        boolean hasScheme = SCHEME.matcher(s).find() && !HOST_PORT.matcher(s).matches();
        return hasScheme ? s : "https://" + s;
    }

    /** scheme://authority. 파싱 불가/호스트 없음이면 null */
    public static String origin(URI u) {
        if (u == null || u.getScheme() == null || u.getRawAuthority() == null) return null;
        return u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getRawAuthority();
    }

    /** 표시용 도메인: authority 에서 선행 "www." 만 제거 */
    public static String displayDomain(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            URI u = URI.create(url.trim());
            String auth = u.getRawAuthority();
            if (auth == null) return "";
            return auth.regionMatches(true, 0, "www.", 0, 4) ? auth.substring(4) : auth;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /** 경로 부분만(없으면 "") */
    public static String pathOf(String url) {
        if (url == null) return "";
        try {
            String p = URI.create(url.trim()).getRawPath();
            return p == null ? "" : p;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
