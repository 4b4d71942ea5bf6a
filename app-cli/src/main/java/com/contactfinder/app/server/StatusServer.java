package com.contactfinder.app.server;

import com.contactfinder.core.export.JsonResultWriter;
import com.contactfinder.core.model.CrawlStatus;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.service.CrawlJobManager;
import com.contactfinder.core.util.NamedThreadFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 로컬 상태/제어 HTTP 엔드포인트 + 폴링 UI.
 *  GET  /api/status  → 현재 스냅샷 JSON
 *  POST /api/start   → 202 started / 409 이미 실행 중 / 400 잘못된 본문
 *  POST /api/cancel  → 202 / 409 실행 중 아님
 *  GET  /            → static/index.html, /static/* → 클래스패스 자원
 */
public final class StatusServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final CrawlJobManager jobs;
    private final CrawlerConfig defaults;
    private final HttpServer http;
    private final ExecutorService pool;

    public StatusServer(CrawlJobManager jobs, CrawlerConfig defaults, int port) throws IOException {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.defaults = Objects.requireNonNull(defaults, "defaults").copy();
        this.http = HttpServer.create(new InetSocketAddress(port), 0);
        this.pool = Executors.newFixedThreadPool(4, new NamedThreadFactory("status-http"));

        http.createContext("/api/status", guarded("GET", this::status));
        http.createContext("/api/start", guarded("POST", this::start));
        http.createContext("/api/cancel", guarded("POST", this::cancel));
        http.createContext("/", guarded("GET", this::staticAsset));
        http.setExecutor(pool);
    }

    public void start() {
        http.start();
        LOG.info("UI running on http://localhost:{}", getPort());
    }

    public int getPort() {
        return http.getAddress().getPort();
    }

    @Override
    public void close() {
        http.stop(0);
        pool.shutdownNow();
    }

    /* =========================
       handlers
       ========================= */

    private void status(HttpExchange ex) throws IOException {
        json(ex, 200, toJson(jobs.snapshot()));
    }

    private void start(HttpExchange ex) throws IOException {
        CrawlerConfig cfg;
        try {
            cfg = buildConfig(readBody(ex));
            cfg.validate();
        } catch (JsonProcessingException e) {
            json(ex, 400, Map.of("error", "Invalid JSON body"));
            return;
        } catch (IllegalArgumentException | NullPointerException e) {
            json(ex, 400, Map.of("error", String.valueOf(e.getMessage())));
            return;
        }

        if (!jobs.start(cfg)) {
            json(ex, 409, Map.of("error", "Crawler already running"));
            return;
        }
        json(ex, 202, Map.of("status", "started"));
    }

    private void cancel(HttpExchange ex) throws IOException {
        if (!jobs.cancel()) {
            json(ex, 409, Map.of("error", "Crawler not running"));
            return;
        }
        json(ex, 202, Map.of("status", "cancelling"));
    }

    private void staticAsset(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        String asset;
        if (path.equals("/") || path.equals("/index.html")) {
            asset = "index.html";
        } else if (path.startsWith("/static/") && !path.contains("..")) {
            asset = path.substring("/static/".length());
        } else {
            text(ex, 404, "Not Found");
            return;
        }

        try (InputStream in = StatusServer.class.getResourceAsStream("/static/" + asset)) {
            if (in == null) {
                text(ex, 404, "Not Found");
                return;
            }
            send(ex, 200, contentType(asset), in.readAllBytes());
        }
    }

    /* =========================
       start payload → config
       ========================= */

    /** 본문 키: directory_url, delay(초), timeout(초), output. 없는 키는 서버 기본값 */
    CrawlerConfig buildConfig(String body) throws JsonProcessingException {
        CrawlerConfig cfg = defaults.copy();
        if (body == null || body.isBlank()) return cfg;

        JsonNode root = om.readTree(body);
        if (root == null || root.isNull()) return cfg;
        if (!root.isObject()) throw new IllegalArgumentException("JSON object expected");

        JsonNode url = root.get("directory_url");
        if (url != null && !url.isNull()) cfg.setDirectoryUrl(url.asText());

        JsonNode delay = root.get("delay");
        if (delay != null && !delay.isNull()) cfg.setDelaySeconds(number(delay, "delay"));

        JsonNode timeout = root.get("timeout");
        if (timeout != null && !timeout.isNull()) {
            cfg.setTimeout(Duration.ofMillis(Math.round(number(timeout, "timeout") * 1000.0)));
        }

        JsonNode output = root.get("output");
        if (output != null && !output.isNull()) cfg.setOutput(Path.of(output.asText()));
        return cfg;
    }

    private static double number(JsonNode n, String field) {
        double d;
        if (n.isNumber()) {
            d = n.asDouble();
        } else {
            try {
                d = Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " must be a number");
            }
        }
        if (!Double.isFinite(d)) throw new IllegalArgumentException(field + " must be a finite number");
        return d;
    }

    /* =========================
       JSON 변환
       ========================= */

    Map<String, Object> toJson(CrawlStatus s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total", s.getTotal());
        m.put("completed", s.getCompleted());
        m.put("currentSite", s.getCurrentSite());
        m.put("startedAt", s.getStartedAt());
        m.put("finishedAt", s.getFinishedAt());
        m.put("results", s.getResults().stream().map(JsonResultWriter::row).toList());
        m.put("running", s.isRunning());
        m.put("cancelled", s.isCancelled());
        m.put("error", s.getError());
        return m;
    }

    /* =========================
       공용 유틸
       ========================= */

    private static HttpHandler guarded(String method, HttpHandler h) {
        return ex -> {
            try {
                if (!method.equalsIgnoreCase(ex.getRequestMethod())) {
                    ex.getResponseHeaders().set("Allow", method);
                    text(ex, 405, "Method Not Allowed");
                    return;
                }
                h.handle(ex);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Request failed: {} {} ({})", ex.getRequestMethod(), ex.getRequestURI(), e.toString());
                throw e;
            } finally {
                ex.close();
            }
        };
    }

    private static String readBody(HttpExchange ex) throws IOException {
        try (InputStream in = ex.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void json(HttpExchange ex, int code, Object payload) throws IOException {
        send(ex, code, "application/json", om.writeValueAsBytes(payload));
    }

    private static void text(HttpExchange ex, int code, String body) throws IOException {
        send(ex, code, "text/plain", body.getBytes(StandardCharsets.UTF_8));
    }

    private static void send(HttpExchange ex, int code, String ct, byte[] body) throws IOException {
        ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
        ex.sendResponseHeaders(code, body.length == 0 ? -1 : body.length);
        if (body.length == 0) return;
        try (OutputStream os = ex.getResponseBody()) { os.write(body); }
    }

    private static String contentType(String asset) {
        if (asset.endsWith(".js")) return "text/javascript";
        if (asset.endsWith(".css")) return "text/css";
        return "text/html";
    }
}
