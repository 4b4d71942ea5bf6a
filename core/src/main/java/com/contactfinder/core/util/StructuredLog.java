package com.contactfinder.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (java.util.logging 위).
 * 사람이 읽는 메시지는 SLF4J, 집계용 이벤트(site-done, job-failed 등)는 여기.
 * 사용: SLOG.info("site-done", "site", url, "emails", 3)
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();

    private final Logger jul;
    private final String component;

    private StructuredLog(Class<?> owner) {
        this.jul = Logger.getLogger(owner.getName());
        this.component = owner.getSimpleName();
    }

    public static StructuredLog get(Class<?> owner) {
        return new StructuredLog(owner);
    }

    public void debug(String event, Object... pairs) { emit(Level.FINE, event, null, pairs); }

    public void info(String event, Object... pairs) { emit(Level.INFO, event, null, pairs); }

    public void warn(String event, Object... pairs) { emit(Level.WARNING, event, null, pairs); }

    public void error(String event, Throwable cause, Object... pairs) { emit(Level.SEVERE, event, cause, pairs); }

    private void emit(Level level, String event, Throwable cause, Object... pairs) {
        if (!jul.isLoggable(level)) return;
        String line = toJson(level, event, cause, pairs);
        if (cause == null) {
            jul.log(level, line);
        } else {
            jul.log(level, line, cause);
        }
    }

    String toJson(Level level, String event, Throwable cause, Object... pairs) {
        ObjectNode n = OM.createObjectNode()
                .put("ts", Instant.now().toString())
                .put("lvl", level.getName())
                .put("comp", component)
                .put("thread", Thread.currentThread().getName())
                .put("event", event);

        int len = (pairs == null) ? 0 : pairs.length;
        for (int i = 0; i + 1 < len; i += 2) {
            put(n, String.valueOf(pairs[i]), pairs[i + 1]);
        }
        if (len % 2 == 1) n.put("_kv_mismatch", true);

        if (cause != null) {
            n.put("error", cause.getClass().getSimpleName());
            n.put("message", cause.getMessage());
        }
        try {
            return OM.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            return "{\"event\":\"" + event + "\",\"_encode_error\":true}";
        }
    }

    // 숫자/불리언은 그대로, 나머지는 문자열
    private static void put(ObjectNode n, String key, Object v) {
        if (v == null) n.putNull(key);
        else if (v instanceof Integer i) n.put(key, i);
        else if (v instanceof Long l) n.put(key, l);
        else if (v instanceof Number num) n.put(key, num.doubleValue());
        else if (v instanceof Boolean b) n.put(key, b);
        else n.put(key, String.valueOf(v));
    }
}
