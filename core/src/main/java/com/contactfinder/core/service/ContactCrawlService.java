// core/src/main/java/com/contactfinder/core/service/ContactCrawlService.java
package com.contactfinder.core.service;

import com.contactfinder.core.api.ICrawler;
import com.contactfinder.core.api.IFetcher;
import com.contactfinder.core.crawler.DirectoryCrawler;
import com.contactfinder.core.crawler.LinkHeuristics;
import com.contactfinder.core.extract.ContactExtractor;
import com.contactfinder.core.http.HttpFetcher;
import com.contactfinder.core.http.TransportException;
import com.contactfinder.core.model.ContactSet;
import com.contactfinder.core.model.CrawlResult;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.util.DefaultSleeper;
import com.contactfinder.core.util.ProgressListener;
import com.contactfinder.core.util.Sleeper;
import com.contactfinder.core.util.StructuredLog;
import com.contactfinder.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤 오케스트레이터:
 *  - discover → (사이트별) 홈 fetch → 추출 → 후보 페이지 fetch* → 병합
 *  - 사이트 처리는 엄격히 순차. delay 는 실행 전체가 공유하는 예의(politeness) 예산
 *  - 홈 실패는 결과(error)로 기록하고 다음 사이트로, 후보 페이지 실패는 PARTIAL 로만 남김
 *  - 재시도/백오프 없음: 실패한 URL 은 이번 실행에서 끝
 */
public final class ContactCrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(ContactCrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ContactCrawlService.class);

    private final CrawlerConfig config;
    private final ICrawler crawler;
    private final IFetcher fetcher;
    private final LinkHeuristics links;
    private final Sleeper sleeper;

    /** 기본 구현 (JDK HttpClient + jsoup + 실제 sleep) */
    public ContactCrawlService(CrawlerConfig config) {
        this(config, new HttpFetcher(validated(config).copy()), new DefaultSleeper());
    }

    /** fetcher/sleeper 주입 (테스트용) */
    public ContactCrawlService(CrawlerConfig config, IFetcher fetcher, Sleeper sleeper) {
        this(config, null, fetcher, new LinkHeuristics(), sleeper);
    }

    /** DI/테스트/플러그인용. crawler 가 null 이면 디렉터리 크롤러 사용 */
    public ContactCrawlService(CrawlerConfig config, ICrawler crawler, IFetcher fetcher,
                               LinkHeuristics links, Sleeper sleeper) {
        this.config = validated(config).copy();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.links = Objects.requireNonNull(links, "links");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.crawler = (crawler != null) ? crawler : new DirectoryCrawler(this.config, fetcher, links);
    }

    /* =========================
       실행 API
       ========================= */

    public List<CrawlResult> run() {
        return run(ProgressListener.NONE, null);
    }

    public List<CrawlResult> run(ProgressListener listener) {
        return run(listener, null);
    }

    /**
     * 진행률 + 취소 플래그(옵션).
     * @throws CrawlRunException     디렉터리 단계 실패 등 실행 단위 오류
     * @throws CancellationException 취소 플래그 또는 워커 인터럽트
     */
    public List<CrawlResult> run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        LOG.info("Crawl start: directory={}, delayMs={}, timeoutMs={}, maxContactPages={}",
                config.getDirectoryUrl(), config.getDelay().toMillis(),
                config.getTimeoutMs(), config.getMaxContactPages());
        SLOG.info("crawl-start",
                "directory", config.getDirectoryUrl(),
                "delayMs", config.getDelay().toMillis(),
                "maxContactPages", config.getMaxContactPages());

        // ---- 0) 사이트 발견 ----
        final List<String> sites;
        try {
            sites = crawler.crawlSeeds();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during discovery");
        }

        final int total = sites.size();
        final List<CrawlResult> results = new ArrayList<>(total);

        // ---- 1) 사이트별 순차 처리 ----
        for (int i = 0; i < total; i++) {
            checkCancel(cancelFlag);
            String site = sites.get(i);
            int index = i + 1;

            CrawlResult result = crawlSite(site, cancelFlag);
            results.add(result);

            if (result.isFailed()) {
                LOG.info("[{}/{}] {} -> ERROR: {}", index, total, site, result.getError());
            } else {
                LOG.info("[{}/{}] {} -> {} emails, {} phones", index, total, site,
                        result.getEmails().size(), result.getPhones().size());
            }
            SLOG.info("site-done",
                    "site", site,
                    "index", index,
                    "total", total,
                    "outcome", result.getOutcome(),
                    "emails", result.getEmails().size(),
                    "phones", result.getPhones().size());

            try {
                pl.onSiteCompleted(index, total, result);
            } catch (RuntimeException e) {
                // 관측자 오류가 실행을 깨지 않도록
                LOG.warn("Progress listener failed: {}", e.toString());
            }

            pause(cancelFlag);
        }

        long failed = results.stream().filter(CrawlResult::isFailed).count();
        LOG.info("Crawl done. sites={}, failed={}", total, failed);
        SLOG.info("crawl-done", "sites", total, "failed", failed);
        return results;
    }

    /**
     * 사이트 1개 처리. 홈 fetch 실패만 FAILED, 나머지는 COMPLETE/PARTIAL.
     */
    CrawlResult crawlSite(String site, AtomicBoolean cancelFlag) {
        String home;
        try {
            home = fetchOrThrow(site);
        } catch (TransportException e) {
            return CrawlResult.failed(site, e.getMessage());
        }

        ContactSet contacts = ContactExtractor.extract(home);
        List<String> candidates = links.findCandidateContactPages(home, site, config);
        List<String> skipped = new ArrayList<>();

        for (String page : candidates) {
            pause(cancelFlag);
            try {
                String html = fetchOrThrow(page);
                contacts = contacts.union(ContactExtractor.extract(html));
            } catch (TransportException e) {
                // 연락처 페이지 실패는 치명적이지 않음: 건너뛰고 기록만
                skipped.add(page);
                LOG.debug("Contact page skipped: {} ({})", page, e.getMessage());
            }
        }

        return CrawlResult.builder()
                .site(site)
                .contacts(contacts)
                .contactPagesChecked(candidates)
                .skippedContactPages(skipped)
                .build();
    }

    private String fetchOrThrow(String url) throws TransportException {
        URI u = UrlUtils.parseLenient(url);
        if (u == null) throw new TransportException(null, -1, "malformed url: " + url);
        try {
            return fetcher.fetch(u);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while fetching " + url);
        }
    }

    /** delay 만큼 대기 (취소 확인 포함) */
    private void pause(AtomicBoolean cancelFlag) {
        checkCancel(cancelFlag);
        try {
            sleeper.sleep(config.getDelay());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting");
        }
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException("Crawl cancelled");
        }
    }

    private static CrawlerConfig validated(CrawlerConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return config;
    }

    public CrawlerConfig getConfig() {
        return config;
    }
}
