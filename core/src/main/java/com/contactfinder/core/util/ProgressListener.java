package com.contactfinder.core.util;

import com.contactfinder.core.model.CrawlResult;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 사이트 1개 처리 완료 시 1회 호출 (성공/실패 무관).
     * @param completed 완료 수 (1부터)
     * @param total     전체 사이트 수
     * @param result    방금 끝난 사이트 결과
     */
    void onSiteCompleted(int completed, int total, CrawlResult result);

    ProgressListener NONE = (c, t, r) -> {};
}
