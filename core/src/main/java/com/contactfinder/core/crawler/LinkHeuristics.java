package com.contactfinder.core.crawler;

import com.contactfinder.core.model.Anchor;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 링크 수집 + 연락처 후보 페이지 선정.
 * 후보 기준: 힌트 키워드가 링크 텍스트 또는 원본 href 에 (대소문자 무시) 부분 문자열로 포함.
 */
public class LinkHeuristics {

    private final LinkExtractor extractor;

    public LinkHeuristics() {
        this(new JsoupLinkExtractor());
    }

    public LinkHeuristics(LinkExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /** 모든 링크를 절대 URL 집합으로. 이미 http(s) 로 시작하면 원본 유지 (순서 없음) */
    public Set<String> extractLinks(String html, String baseUrl) {
        Set<String> links = new HashSet<>();
        for (Anchor a : extractor.anchors(html, baseUrl)) {
            String href = a.href().trim();
            if (href.isEmpty()) continue;
            String abs = absolute(href, a);
            if (abs != null) links.add(abs);
        }
        return links;
    }

    /** 문서 순서 + 첫 등장 순서 유지, maxContactPages 개로 자름 */
    public List<String> findCandidateContactPages(String html, String baseUrl, CrawlerConfig config) {
        int max = Math.max(0, config.getMaxContactPages());
        List<String> hints = config.getContactHints();

        LinkedHashSet<String> candidates = new LinkedHashSet<>();
        for (Anchor a : extractor.anchors(html, baseUrl)) {
            if (candidates.size() >= max) break;

            String text = a.text().toLowerCase(Locale.ROOT);
            String target = a.href().toLowerCase(Locale.ROOT);
            if (!matchesAny(hints, text, target)) continue;

            String abs = absolute(a.href().trim(), a);
            if (abs != null) candidates.add(abs);
        }
        return new ArrayList<>(candidates);
    }

    private static boolean matchesAny(List<String> hints, String text, String target) {
        for (String hint : hints) {
            String h = hint.toLowerCase(Locale.ROOT);
            if (text.contains(h) || target.contains(h)) return true;
        }
        return false;
    }

    // 절대 http(s) 는 그대로, 나머지는 파서가 해석한 값 (해석 불가면 null)
    private static String absolute(String href, Anchor a) {
        if (UrlUtils.isAbsoluteHttp(href)) return href;
        return a.absUrl().isEmpty() ? null : a.absUrl();
    }
}
