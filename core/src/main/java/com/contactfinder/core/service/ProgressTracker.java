package com.contactfinder.core.service;

import com.contactfinder.core.model.CrawlResult;
import com.contactfinder.core.model.CrawlStatus;
import com.contactfinder.core.util.ProgressListener;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 실행 1건의 진행 상태 보관소 (단일 writer / 다수 reader).
 * 모든 메서드는 같은 락 안에서 한 번에 처리되므로 관측자는 반쯤 갱신된 상태를 볼 수 없다.
 * 라이브 리스트는 밖으로 나가지 않고 snapshot() 사본만 나간다.
 */
public final class ProgressTracker implements ProgressListener {

    private final Object lock = new Object();
    private final Clock clock;

    // ---- 라이브 상태 (lock 보호) ----
    private int total;
    private int completed;
    private String currentSite;
    private Instant startedAt;
    private Instant finishedAt;
    private final List<CrawlResult> results = new ArrayList<>();
    private boolean running;
    private boolean cancelled;
    private String error;

    public ProgressTracker() {
        this(Clock.systemUTC());
    }

    public ProgressTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 이전 상태를 버리고 running=true 로 새로 시작 */
    public void start() {
        synchronized (lock) {
            total = 0;
            completed = 0;
            currentSite = null;
            startedAt = clock.instant();
            finishedAt = null;
            results.clear();
            running = true;
            cancelled = false;
            error = null;
        }
    }

    /**
     * 사이트 완료 기록. completed-1 슬롯이 이미 있으면 덮어쓰고, 없으면 append.
     * 같은 인덱스로 두 번 불려도 한 칸만 차지한다.
     */
    public void update(int completed, int total, CrawlResult result) {
        Objects.requireNonNull(result, "result");
        if (completed < 1) throw new IllegalArgumentException("completed must be >= 1");
        synchronized (lock) {
            if (finishedAt != null) return; // 종료 후에는 새 start() 전까지 불변
            this.completed = completed;
            this.total = total;
            this.currentSite = result.getSite();
            int slot = completed - 1;
            if (slot < results.size()) {
                results.set(slot, result);
            } else {
                results.add(result);
            }
        }
    }

    @Override
    public void onSiteCompleted(int completed, int total, CrawlResult result) {
        update(completed, total, result);
    }

    /** 정상 종료 */
    public void finish() {
        synchronized (lock) {
            if (finishedAt != null) return;
            running = false;
            finishedAt = clock.instant();
            currentSite = null;
        }
    }

    /** 실행 단위 치명 오류 (사이트 단위 오류와 별개) */
    public void setError(String message) {
        synchronized (lock) {
            if (finishedAt != null) return;
            error = (message == null || message.isBlank()) ? "unknown error" : message;
            running = false;
            finishedAt = clock.instant();
        }
    }

    /** 취소로 인한 종료 */
    public void markCancelled() {
        synchronized (lock) {
            if (finishedAt != null) return;
            cancelled = true;
            running = false;
            finishedAt = clock.instant();
            currentSite = null;
        }
    }

    /** 불변 사본 */
    public CrawlStatus snapshot() {
        synchronized (lock) {
            return new CrawlStatus(total, completed, currentSite, startedAt, finishedAt,
                    results, running, cancelled, error);
        }
    }

    /** start/finish 사이인지 (단일 실행 가드용) */
    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }
}
