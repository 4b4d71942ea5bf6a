package com.contactfinder.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** URL → 사이트 루트 정규화 + 관대한 파싱 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** scheme://authority 접두부. java.net.URI 가 거부하는 문자열에도 적용 */
    private static final Pattern SCHEME_AUTHORITY =
            Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*)://([^/?#]+)");

    /** 경로/쿼리/프래그먼트에서 URI 가 허용하지 않는 ASCII 문자 */
    private static final String ILLEGAL = " \"<>\\^`{|}[]";

    /**
     * 사이트 루트 규칙:
     * - scheme 또는 host(authority) 가 없으면 empty
     * - 결과는 scheme://authority/ (path/query/fragment 제거)
     * - host 대소문자는 그대로 둔다 (https://Example.com/about → https://Example.com/)
     * - 포트가 있으면 authority 에 그대로 남는다
     * - 경로/쿼리에 잘못된 문자가 있어도 루트는 구한다 (?utm=x|y, /100%)
     */
    public static Optional<String> siteRoot(String url) {
        if (url == null) return Optional.empty();
        URI u = parseLenient(url);
        if (u != null) {
            String scheme = u.getScheme();
            String authority = u.getRawAuthority();
            if (scheme != null && !scheme.isEmpty() && authority != null && !authority.isEmpty()) {
                return Optional.of(scheme + "://" + authority + "/");
            }
        }
        Matcher m = SCHEME_AUTHORITY.matcher(url.trim());
        if (!m.find()) return Optional.empty();
        return Optional.of(m.group(1) + "://" + m.group(2) + "/");
    }

    /** http:// 또는 https:// 로 시작하는 절대 URL 인지 (대소문자 구분, 원본 href 기준) */
    public static boolean isAbsoluteHttp(String href) {
        return href != null && (href.startsWith("http://") || href.startsWith("https://"));
    }

    /** 허용되지 않는 문자는 퍼센트 인코딩해서 재시도, 그래도 안 되면 null */
    public static URI parseLenient(String url) {
        if (url == null) return null;
        String s = url.trim();
        if (s.isEmpty()) return null;
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            try {
                return new URI(encodeIllegal(s));
            } catch (URISyntaxException ignore) {
                return null;
            }
        }
    }

    /**
     * authority 뒤쪽만 인코딩한다.
     * - 공백, | { } ^ 등 → %XX
     * - 16진수 두 자리가 뒤따르지 않는 % → %25 (이미 인코딩된 %20 은 그대로)
     * - 두 번째 이후의 # → %23
     */
    static String encodeIllegal(String s) {
        Matcher m = SCHEME_AUTHORITY.matcher(s);
        int start = m.find() ? m.end() : 0;

        StringBuilder sb = new StringBuilder(s.length() + 16);
        sb.append(s, 0, start);
        boolean fragment = false;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '%') {
                boolean escaped = i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2));
                sb.append(escaped ? "%" : "%25");
            } else if (c == '#') {
                sb.append(fragment ? "%23" : "#");
                fragment = true;
            } else if (c < 0x20 || c == 0x7f || ILLEGAL.indexOf(c) >= 0) {
                sb.append('%').append(String.format("%02X", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
