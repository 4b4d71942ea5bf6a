package com.contactfinder.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (crawler.yml 매핑 대상). 순수 설정 보관용.
 * CLI/HTTP 트리거는 defaults() 위에 값을 덮어쓴 뒤 validate()를 호출한다.
 * 엔진은 copy()로 받은 사본만 사용하므로 실행 중 원본을 바꿔도 영향 없음.
 */
public final class CrawlerConfig {

    public static final String DEFAULT_DIRECTORY_URL = "https://sverigestidskrifter.se/vara-medlemmar/";
    public static final List<String> DEFAULT_CONTACT_HINTS = List.of(
            "kontakt", "contact", "om", "about", "annonser", "editor", "redaktion");
    public static final String DEFAULT_USER_AGENT = "ContactFinder/1.0 (+local script)";

    // ---------- 기본 필드 ----------
    private String directoryUrl = DEFAULT_DIRECTORY_URL;   // 회원 디렉터리 페이지 (필수)
    private List<String> contactHints = DEFAULT_CONTACT_HINTS;
    private String userAgent = DEFAULT_USER_AGENT;
    private Duration timeout = Duration.ofSeconds(15);     // 요청 타임아웃
    private Duration delay = Duration.ofMillis(1000);      // 요청 간 대기(전체 실행 공용)
    private int maxContactPages = 8;                       // 사이트당 연락처 후보 페이지 상한
    private Path output = Path.of("sverigestidskrifter_contacts.csv");

    // ---------- getters ----------
    public String getDirectoryUrl() { return directoryUrl; }
    public List<String> getContactHints() { return contactHints; }
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public Duration getDelay() { return delay; }
    public int getMaxContactPages() { return maxContactPages; }
    public Path getOutput() { return output; }

    // ---------- fluent setters ----------
    public CrawlerConfig setDirectoryUrl(String directoryUrl) { this.directoryUrl = directoryUrl; return this; }

    /** 힌트는 소문자로 정규화, 순서 유지 + 중복 제거. null/빈 리스트면 기존 값 유지 */
    public CrawlerConfig setContactHints(List<String> hints) {
        if (hints == null || hints.isEmpty()) return this;
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String h : hints) {
            if (h == null || h.isBlank()) continue;
            out.add(h.trim().toLowerCase(Locale.ROOT));
        }
        if (!out.isEmpty()) this.contactHints = List.copyOf(out);
        return this;
    }

    public CrawlerConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlerConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlerConfig setDelay(Duration delay) { this.delay = delay; return this; }
    public CrawlerConfig setMaxContactPages(int maxContactPages) { this.maxContactPages = maxContactPages; return this; }
    public CrawlerConfig setOutput(Path output) { this.output = output; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(directoryUrl, "directoryUrl");
        if (directoryUrl.isBlank()) throw new IllegalArgumentException("directoryUrl must not be blank");
        Objects.requireNonNull(contactHints, "contactHints");
        Objects.requireNonNull(userAgent, "userAgent");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (delay == null || delay.isNegative())
            throw new IllegalArgumentException("delay must be >= 0");
        if (maxContactPages < 0) throw new IllegalArgumentException("maxContactPages must be >= 0");
        Objects.requireNonNull(output, "output");
    }

    // ---------- helpers ----------
    public static CrawlerConfig defaults() { return new CrawlerConfig(); }

    /** 실행 단위 사본 (리스트는 이미 불변) */
    public CrawlerConfig copy() {
        CrawlerConfig c = new CrawlerConfig();
        c.directoryUrl = directoryUrl;
        c.contactHints = List.copyOf(contactHints);
        c.userAgent = userAgent;
        c.timeout = timeout;
        c.delay = delay;
        c.maxContactPages = maxContactPages;
        c.output = output;
        return c;
    }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlerConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** 초 단위(소수 허용) 지연 설정: CLI --delay 1.5 */
    public CrawlerConfig setDelaySeconds(double seconds) {
        // NaN 은 반올림하면 0ms 가 되어 validate() 를 통과한다
        if (!Double.isFinite(seconds)) throw new IllegalArgumentException("delay must be a finite number");
        this.delay = Duration.ofMillis(Math.round(seconds * 1000.0));
        return this;
    }

    @Override
    public String toString() {
        return "CrawlerConfig{directoryUrl=" + directoryUrl
                + ", hints=" + contactHints
                + ", timeoutMs=" + getTimeoutMs()
                + ", delayMs=" + (delay == null ? null : delay.toMillis())
                + ", maxContactPages=" + maxContactPages
                + ", output=" + output + '}';
    }
}
