package com.contactfinder.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 진행 상태 불변 스냅샷. 관측자(HTTP/CLI)는 항상 이 사본만 받는다.
 * 라이브 상태는 ProgressTracker 내부에만 존재.
 */
public final class CrawlStatus {

    private final int total;
    private final int completed;
    private final String currentSite;      // 없으면 null
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<CrawlResult> results;
    private final boolean running;
    private final boolean cancelled;
    private final String error;            // 실행 단위 치명 오류 (사이트 단위 오류는 results 안에)

    public CrawlStatus(int total, int completed, String currentSite,
                       Instant startedAt, Instant finishedAt,
                       List<CrawlResult> results,
                       boolean running, boolean cancelled, String error) {
        this.total = total;
        this.completed = completed;
        this.currentSite = currentSite;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.results = (results == null) ? List.of() : List.copyOf(results);
        this.running = running;
        this.cancelled = cancelled;
        this.error = error;
    }

    public int getTotal() { return total; }
    public int getCompleted() { return completed; }
    public String getCurrentSite() { return currentSite; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public List<CrawlResult> getResults() { return results; }
    public boolean isRunning() { return running; }
    public boolean isCancelled() { return cancelled; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return "CrawlStatus{" + completed + "/" + total
                + ", running=" + running
                + (cancelled ? ", cancelled" : "")
                + (currentSite != null ? ", current=" + currentSite : "")
                + (error != null ? ", error=" + error : "") + '}';
    }
}
