package com.contactfinder.core.service;

import com.contactfinder.core.api.IFetcher;
import com.contactfinder.core.http.TransportException;
import com.contactfinder.core.model.CrawlResult;
import com.contactfinder.core.model.CrawlStatus;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.util.Sleeper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContactCrawlServiceTest {

    private static final String DIRECTORY = "https://dir.example/members";

    /** URL → HTML 맵 기반 가짜 fetcher. failing 에 있으면 연결 실패 */
    static class MapFetcher implements IFetcher {
        final Map<String, String> pages = new HashMap<>();
        final Set<String> failing = new HashSet<>();
        final List<String> calls = new ArrayList<>();

        MapFetcher page(String url, String html) { pages.put(url, html); return this; }
        MapFetcher fail(String url) { failing.add(url); return this; }

        @Override
        public String fetch(URI url) throws TransportException {
            String key = url.toString();
            calls.add(key);
            if (failing.contains(key)) throw new TransportException(url, -1, "ConnectException: Connection refused");
            String html = pages.get(key);
            if (html == null) throw new TransportException(url, 404, "404 error for url: " + key);
            return html;
        }
    }

    /** 테스트용 Sleeper: sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    private static CrawlerConfig cfg() {
        return CrawlerConfig.defaults()
                .setDirectoryUrl(DIRECTORY)
                .setDelay(Duration.ofMillis(250));
    }

    private static MapFetcher twoSites() {
        return new MapFetcher()
                .page(DIRECTORY, "<a href=\"https://b.example/start\">B</a><a href=\"https://a.example/\">A</a>")
                .page("https://a.example/", "<p>Mail: info@a.example</p><a href=\"/kontakt\">Kontakt</a>")
                .page("https://a.example/kontakt", "<p>Tel: +46 8 123 45 67</p>")
                .fail("https://b.example/");
    }

    @Test
    void endToEnd_twoSites_oneReachable_oneDown() {
        MapFetcher fetcher = twoSites();
        TestSleeper sleeper = new TestSleeper();
        ProgressTracker tracker = new ProgressTracker();
        ContactCrawlService svc = new ContactCrawlService(cfg(), fetcher, sleeper);

        tracker.start();
        List<CrawlResult> results = svc.run(tracker);
        tracker.finish();

        assertThat(results).hasSize(2);

        CrawlResult a = results.get(0);
        assertThat(a.getSite()).isEqualTo("https://a.example/");
        assertThat(a.getEmails()).containsExactly("info@a.example");
        assertThat(a.getPhones()).containsExactly("+46 8 123 45 67");
        assertThat(a.getContactPagesChecked()).containsExactly("https://a.example/kontakt");
        assertThat(a.getError()).isNull();
        assertThat(a.getOutcome()).isEqualTo(CrawlResult.Outcome.COMPLETE);

        CrawlResult b = results.get(1);
        assertThat(b.getSite()).isEqualTo("https://b.example/");
        assertThat(b.getEmails()).isEmpty();
        assertThat(b.getPhones()).isEmpty();
        assertThat(b.getContactPagesChecked()).isEmpty();
        assertThat(b.getError()).isNotBlank();
        assertThat(b.getOutcome()).isEqualTo(CrawlResult.Outcome.FAILED);

        CrawlStatus s = tracker.snapshot();
        assertThat(s.getCompleted()).isEqualTo(2);
        assertThat(s.getTotal()).isEqualTo(2);
        assertThat(s.isRunning()).isFalse();
        assertThat(s.getResults()).containsExactlyElementsOf(results);

        // 후보 페이지 전 1회 + 사이트마다 1회
        assertThat(sleeper.sleeps).hasSize(3).containsOnly(Duration.ofMillis(250));
        assertThat(fetcher.calls).containsExactly(
                DIRECTORY, "https://a.example/", "https://a.example/kontakt", "https://b.example/");
    }

    @Test
    void contactPageFailure_is_partial_not_error() {
        MapFetcher fetcher = twoSites();
        fetcher.pages.remove("https://a.example/kontakt");
        fetcher.fail("https://a.example/kontakt");

        List<CrawlResult> results = new ContactCrawlService(cfg(), fetcher, new TestSleeper()).run();

        CrawlResult a = results.get(0);
        assertThat(a.getError()).isNull();
        assertThat(a.getEmails()).containsExactly("info@a.example");
        assertThat(a.getPhones()).isEmpty();
        assertThat(a.getContactPagesChecked()).containsExactly("https://a.example/kontakt");
        assertThat(a.getSkippedContactPages()).containsExactly("https://a.example/kontakt");
        assertThat(a.getOutcome()).isEqualTo(CrawlResult.Outcome.PARTIAL);
    }

    @Test
    void contactPage_with_pipe_in_query_is_fetched_percent_encoded() {
        MapFetcher fetcher = new MapFetcher()
                .page(DIRECTORY, "<a href=\"https://a.example/\">A</a>")
                .page("https://a.example/", "<a href=\"https://a.example/kontakt?ref=nav|top\">Kontakt</a>")
                .page("https://a.example/kontakt?ref=nav%7Ctop", "<p>Tel: 08-123 45 67</p>");

        List<CrawlResult> results = new ContactCrawlService(cfg(), fetcher, new TestSleeper()).run();

        CrawlResult a = results.get(0);
        assertThat(a.getContactPagesChecked()).hasSize(1);
        assertThat(a.getSkippedContactPages()).isEmpty();
        assertThat(a.getPhones()).containsExactly("08-123 45 67");
        assertThat(fetcher.calls).last().isEqualTo("https://a.example/kontakt?ref=nav%7Ctop");
    }

    @Test
    void zeroMaxContactPages_fetches_only_home() {
        MapFetcher fetcher = twoSites();
        CrawlerConfig c = cfg().setMaxContactPages(0);

        List<CrawlResult> results = new ContactCrawlService(c, fetcher, new TestSleeper()).run();

        assertThat(results.get(0).getContactPagesChecked()).isEmpty();
        assertThat(results.get(0).getPhones()).isEmpty();
        assertThat(fetcher.calls).doesNotContain("https://a.example/kontakt");
    }

    @Test
    void directoryFailure_surfaces_as_runException() {
        MapFetcher fetcher = new MapFetcher().fail(DIRECTORY);

        assertThatThrownBy(() -> new ContactCrawlService(cfg(), fetcher, new TestSleeper()).run())
                .isInstanceOf(CrawlRunException.class);
    }

    @Test
    void emptyDirectory_gives_empty_results() {
        MapFetcher fetcher = new MapFetcher().page(DIRECTORY, "<p>tom</p>");
        ProgressTracker tracker = new ProgressTracker();
        tracker.start();

        List<CrawlResult> results = new ContactCrawlService(cfg(), fetcher, new TestSleeper()).run(tracker);
        tracker.finish();

        assertThat(results).isEmpty();
        assertThat(tracker.snapshot().getTotal()).isZero();
        assertThat(tracker.snapshot().getCompleted()).isZero();
    }

    @Test
    void cancelFlag_stops_after_current_site() {
        MapFetcher fetcher = twoSites();
        AtomicBoolean cancel = new AtomicBoolean(false);
        List<CrawlResult> seen = new ArrayList<>();

        ContactCrawlService svc = new ContactCrawlService(cfg(), fetcher, new TestSleeper());

        assertThatThrownBy(() -> svc.run((done, total, r) -> {
            seen.add(r);
            cancel.set(true);
        }, cancel)).isInstanceOf(CancellationException.class);

        assertThat(seen).hasSize(1);
        assertThat(fetcher.calls).doesNotContain("https://b.example/");
    }

    @Test
    void failingListener_does_not_break_the_run() {
        List<CrawlResult> results = new ContactCrawlService(cfg(), twoSites(), new TestSleeper())
                .run((done, total, r) -> { throw new IllegalStateException("ui gone"); });

        assertThat(results).hasSize(2);
    }

    @Test
    @DisplayName("생성 후 호출자가 설정을 바꿔도 실행 중인 크롤에는 반영되지 않음")
    void callerConfigChanges_after_construction_do_not_leak() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        List<String> agents = new CopyOnWriteArrayList<>();
        server.createContext("/", ex -> {
            agents.add(ex.getRequestHeaders().getFirst("User-Agent"));
            byte[] body = "<p>tom</p>".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();
        try {
            CrawlerConfig c = CrawlerConfig.defaults()
                    .setDirectoryUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/members")
                    .setUserAgent("ContactFinder-Test/1.0")
                    .setDelay(Duration.ZERO);
            ContactCrawlService svc = new ContactCrawlService(c);

            c.setUserAgent("Changed/2.0").setDirectoryUrl("http://127.0.0.1:1/elsewhere");

            assertThat(svc.run()).isEmpty();
            assertThat(agents).containsExactly("ContactFinder-Test/1.0");
        } finally {
            server.stop(0);
        }
    }

    @Test
    void invalidConfig_is_rejected_at_construction() {
        CrawlerConfig bad = cfg().setDelay(Duration.ofMillis(-1));

        assertThatThrownBy(() -> new ContactCrawlService(bad, twoSites(), new TestSleeper()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
