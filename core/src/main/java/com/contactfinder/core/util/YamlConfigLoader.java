package com.contactfinder.core.util;

import com.contactfinder.core.model.CrawlerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * crawler.yml → CrawlerConfig. 없는 키는 기본값 유지, 모르는 키는 경고만.
 *
 * 예상 YAML 키:
 * directoryUrl: "https://sverigestidskrifter.se/vara-medlemmar/"
 * contactHints: ["kontakt", "contact", "about"]   # 또는 "kontakt,contact"
 * userAgent: "ContactFinder/1.0 (+local script)"
 * timeoutMs: 15000
 * delayMs: 1000
 * maxContactPages: 8
 * output: "contacts.csv"
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    /** 키별 바인더 (선언 순서대로 적용) */
    private static final Map<String, BiConsumer<CrawlerConfig, Object>> BINDERS = new LinkedHashMap<>();
    static {
        BINDERS.put("directoryUrl", (c, v) -> c.setDirectoryUrl(text(v)));
        BINDERS.put("contactHints", (c, v) -> c.setContactHints(hints(v)));
        BINDERS.put("userAgent", (c, v) -> c.setUserAgent(text(v)));
        // 음수도 그대로 넘겨 validate() 가 거르도록 둔다
        BINDERS.put("timeoutMs", (c, v) -> c.setTimeout(Duration.ofMillis(number(v, "timeoutMs"))));
        BINDERS.put("delayMs", (c, v) -> c.setDelay(Duration.ofMillis(number(v, "delayMs"))));
        BINDERS.put("maxContactPages", (c, v) -> c.setMaxContactPages(Math.toIntExact(number(v, "maxContactPages"))));
        BINDERS.put("output", (c, v) -> c.setOutput(Path.of(text(v))));
    }

    private YamlConfigLoader() {}

    public static CrawlerConfig loadDefault() throws IOException {
        return load(Path.of("crawler.yml"));
    }

    public static CrawlerConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.isRegularFile(yamlPath)) {
            throw new IOException("crawler.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /**
     * @throws IllegalArgumentException 값 형식 오류 또는 validate() 실패
     */
    public static CrawlerConfig load(InputStream in) {
        Object doc = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        CrawlerConfig cfg = CrawlerConfig.defaults();

        if (doc instanceof Map<?, ?> root) {
            for (Map.Entry<?, ?> e : root.entrySet()) {
                String key = String.valueOf(e.getKey());
                BiConsumer<CrawlerConfig, Object> binder = BINDERS.get(key);
                if (binder == null) {
                    LOG.warn("Unknown key in crawler.yml ignored: {}", key);
                } else if (e.getValue() != null) {
                    binder.accept(cfg, e.getValue());
                }
            }
        } else if (doc != null) {
            LOG.warn("crawler.yml root is not a mapping; using defaults");
        }

        cfg.validate();
        return cfg;
    }

    /* ------------ 값 변환 ------------ */

    private static String text(Object v) {
        return String.valueOf(v).trim();
    }

    // 리스트 또는 "a, b, c"
    private static List<String> hints(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> items) {
            for (Object o : items) if (o != null) out.add(String.valueOf(o));
        } else {
            for (String p : String.valueOf(v).split(",")) {
                if (!p.isBlank()) out.add(p.trim());
            }
        }
        return out;
    }

    private static long number(Object v, String key) {
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number: " + v);
        }
    }
}
