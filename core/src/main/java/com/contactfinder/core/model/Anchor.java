package com.contactfinder.core.model;

/**
 * 문서 순서대로 추출한 a[href] 한 개.
 * href 는 원본 그대로, absUrl 은 파서가 base 기준으로 해석한 값 (실패 시 빈 문자열).
 */
public record Anchor(String href, String text, String absUrl) {
    public Anchor {
        href = (href == null) ? "" : href;
        text = (text == null) ? "" : text;
        absUrl = (absUrl == null) ? "" : absUrl;
    }
}
