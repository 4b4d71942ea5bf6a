package com.contactfinder.core.http;

import com.contactfinder.core.api.IFetcher;
import com.contactfinder.core.model.CrawlerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/** 단일 GET fetcher: User-Agent + 타임아웃 적용, 실패는 TransportException 으로 분류 */
public class HttpFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlerConfig config;
    private final HttpSender sender;

    /** config 는 복사해서 보관 (생성 이후 호출자의 변경은 반영되지 않음) */
    public HttpFetcher(CrawlerConfig config) {
        this.config = Objects.requireNonNull(config, "config").copy();
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(this.config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(CrawlerConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config").copy();
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    /** GET 1회. 2xx 가 아니면 TransportException (재시도 없음) */
    @Override
    public String fetch(URI url) throws TransportException, InterruptedException {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // http/https 외 스킴, 호스트 누락 등
            throw new TransportException(url, "invalid request url: " + e.getMessage(), e);
        }

        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (IOException e) {
            // HttpTimeoutException / ConnectException / UnresolvedAddress 모두 IOException 계열
            throw new TransportException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        int status = resp.statusCode();
        LOG.debug("GET {} -> {} ({} ms)", url, status, elapsedMs);

        if (status < 200 || status >= 300) {
            throw new TransportException(url, status, status + " error for url: " + url);
        }
        return resp.body() == null ? "" : resp.body();
    }
}
