package com.contactfinder.core.crawler;

import com.contactfinder.core.api.ICrawler;
import com.contactfinder.core.api.IFetcher;
import com.contactfinder.core.http.TransportException;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.service.CrawlRunException;
import com.contactfinder.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 디렉터리 페이지 기반 사이트 발견
 * - 디렉터리 1회 fetch → 링크 전체 수집 → 사이트 루트로 접기
 * - 같은 scheme+host 는 경로가 달라도 1개로, 결과는 사전순 (재실행 시 방문 순서 동일)
 * - 디렉터리 fetch 실패는 실행 전체 실패(CrawlRunException)
 */
public class DirectoryCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryCrawler.class);

    private final CrawlerConfig config;
    private final IFetcher fetcher;
    private final LinkHeuristics links;

    public DirectoryCrawler(CrawlerConfig config, IFetcher fetcher) {
        this(config, fetcher, new LinkHeuristics());
    }

    public DirectoryCrawler(CrawlerConfig config, IFetcher fetcher, LinkHeuristics links) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.links = Objects.requireNonNull(links, "links");
    }

    @Override
    public List<String> crawlSeeds() throws InterruptedException {
        String directoryUrl = config.getDirectoryUrl();
        URI dir = UrlUtils.parseLenient(directoryUrl);
        if (dir == null) {
            throw new CrawlRunException("invalid directory url: " + directoryUrl, null);
        }

        String html;
        try {
            html = fetcher.fetch(dir);
        } catch (TransportException e) {
            throw new CrawlRunException("directory fetch failed: " + e.getMessage(), e);
        }

        Set<String> memberLinks = links.extractLinks(html, directoryUrl);
        Set<String> sites = new TreeSet<>(); // 중복 제거 + 사전순
        for (String link : memberLinks) {
            Optional<String> root = UrlUtils.siteRoot(link);
            root.ifPresent(sites::add); // 스킴/호스트 없는 링크는 조용히 제외
        }

        LOG.info("Discovered {} sites from {} links on {}", sites.size(), memberLinks.size(), directoryUrl);
        return List.copyOf(sites);
    }
}
