package com.contactfinder.core.service;

import com.contactfinder.core.export.ResultWriter;
import com.contactfinder.core.model.CrawlResult;
import com.contactfinder.core.model.CrawlStatus;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.util.NamedThreadFactory;
import com.contactfinder.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 백그라운드 크롤 실행 핸들 (single-flight).
 *  - 실행 중이면 start() 는 false 를 돌려주고 아무것도 하지 않는다
 *  - 워커 1개(crawl-worker-N)에서 run → 결과 파일 쓰기 → finish
 *  - 실행 단위 오류는 tracker.setError, 취소는 tracker.markCancelled
 *  - 관측자는 snapshot() 사본만 받는다
 */
public final class CrawlJobManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlJobManager.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlJobManager.class);

    private final ProgressTracker tracker;
    private final Function<CrawlerConfig, ContactCrawlService> serviceFactory;
    private final Function<Path, ResultWriter> writerFactory;
    private final ExecutorService worker;

    private final Object startLock = new Object();
    private volatile AtomicBoolean activeCancel;
    private volatile Future<?> active;

    public CrawlJobManager() {
        this(new ProgressTracker(), ContactCrawlService::new, ResultWriter::forPath);
    }

    /** DI/테스트용 */
    public CrawlJobManager(ProgressTracker tracker,
                           Function<CrawlerConfig, ContactCrawlService> serviceFactory,
                           Function<Path, ResultWriter> writerFactory) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.serviceFactory = Objects.requireNonNull(serviceFactory, "serviceFactory");
        this.writerFactory = Objects.requireNonNull(writerFactory, "writerFactory");
        this.worker = Executors.newSingleThreadExecutor(new NamedThreadFactory("crawl-worker"));
    }

    /**
     * 새 실행 시작.
     * @return 시작했으면 true, 이미 실행 중이면 false
     * @throws IllegalArgumentException 설정 검증 실패 (시작 전)
     */
    public boolean start(CrawlerConfig config) {
        Objects.requireNonNull(config, "config").validate();
        synchronized (startLock) {
            if (tracker.snapshot().isRunning()) {
                LOG.info("Start rejected: crawl already running");
                return false;
            }
            CrawlerConfig cfg = config.copy();
            AtomicBoolean cancel = new AtomicBoolean(false);
            tracker.start();
            activeCancel = cancel;
            active = worker.submit(() -> runJob(cfg, cancel));
            SLOG.info("job-start", "directory", cfg.getDirectoryUrl(), "output", cfg.getOutput());
            return true;
        }
    }

    /** 실행 중인 작업에 취소 요청. 실행 중이 아니면 false */
    public boolean cancel() {
        AtomicBoolean flag = activeCancel;
        if (flag == null || !tracker.isRunning()) return false;
        flag.set(true);
        LOG.info("Cancel requested");
        return true;
    }

    public CrawlStatus snapshot() {
        return tracker.snapshot();
    }

    /** 현재 작업이 끝날 때까지 대기 (CLI/테스트용). 시간 내 끝나면 true */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        Future<?> f = active;
        if (f == null) return true;
        try {
            f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException | CancellationException e) {
            // runJob 이 예외를 모두 tracker 로 옮기므로 여기까지 오면 버그
            LOG.warn("Crawl job ended abnormally: {}", e.toString());
            return true;
        }
    }

    private void runJob(CrawlerConfig cfg, AtomicBoolean cancel) {
        try {
            ContactCrawlService svc = serviceFactory.apply(cfg);
            List<CrawlResult> results = svc.run(tracker, cancel);
            Path out = writerFactory.apply(cfg.getOutput()).write(results, cfg.getOutput());
            tracker.finish();
            LOG.info("Done. Wrote {}", out);
            SLOG.info("job-done", "sites", results.size(), "output", out);
        } catch (CancellationException ce) {
            // 취소 전까지의 결과는 버리지 않고 기록
            writePartial(cfg);
            tracker.markCancelled();
            LOG.info("Crawl cancelled after {} sites", tracker.snapshot().getCompleted());
            SLOG.info("job-cancelled", "completed", tracker.snapshot().getCompleted());
        } catch (IOException e) {
            tracker.setError("Failed to write results: " + e.getMessage());
            SLOG.error("job-write-failed", e, "output", cfg.getOutput());
        } catch (RuntimeException e) {
            tracker.setError(e.getMessage() != null ? e.getMessage() : e.toString());
            LOG.warn("Crawl failed: {}", e.toString());
            SLOG.error("job-failed", e, "directory", cfg.getDirectoryUrl());
        } finally {
            synchronized (startLock) {
                if (activeCancel == cancel) activeCancel = null;
            }
        }
    }

    private void writePartial(CrawlerConfig cfg) {
        List<CrawlResult> partial = tracker.snapshot().getResults();
        if (partial.isEmpty()) return;
        try {
            writerFactory.apply(cfg.getOutput()).write(partial, cfg.getOutput());
        } catch (IOException e) {
            LOG.warn("Failed to write partial results to {}: {}", cfg.getOutput(), e.getMessage());
        }
    }

    @Override
    public void close() {
        cancel();
        worker.shutdownNow();
        try {
            worker.awaitTermination(10, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
