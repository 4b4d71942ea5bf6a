package com.contactfinder.core.crawler;

import com.contactfinder.core.model.Anchor;

import java.util.List;

/** HTML 에서 a[href] 를 문서 순서대로 꺼내는 전략 인터페이스 (파서 교체/테스트 주입용). */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * @param html    페이지 원문
     * @param baseUrl 상대 링크 해석 기준
     * @return (href, 텍스트, 절대 URL) 목록, 문서 순서
     */
    List<Anchor> anchors(String html, String baseUrl);
}
