package com.contactfinder.core.service;

/**
 * 사이트 단위 격리를 벗어난 실패 (예: 디렉터리 페이지 fetch 실패).
 * 실행 전체를 중단시키며 ProgressTracker 의 error 로 노출된다.
 */
public class CrawlRunException extends RuntimeException {
    public CrawlRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
