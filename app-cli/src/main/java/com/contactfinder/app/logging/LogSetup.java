package com.contactfinder.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J 는 slf4j-jdk14 로 여기에 붙는다).
 * System props:
 *  -Dcf.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dcf.log.sizeMb=2
 *  -Dcf.log.files=5
 *  -Dcf.log.console=true|false (기본 true)
 *  -Dcf.log.file=true|false    (기본 true, logs/contact-finder-%g.log)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** logs 디렉터리 기준 1회 초기화. 두 번째 호출부터는 무시 */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("cf.log.level", "INFO"));
        boolean toConsole = flag("cf.log.console");
        boolean toFile = flag("cf.log.file");

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        if (toFile) {
            try {
                Files.createDirectories(logDir);
                int sizeMb = parseInt(System.getProperty("cf.log.sizeMb"), 2);
                int fileCnt = parseInt(System.getProperty("cf.log.files"), 5);
                String pattern = logDir.resolve("contact-finder-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 콘솔만으로 진행
                root.log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
            }
        }

        root.setLevel(level);
        Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 런타임 레벨 변경 (--verbose 등) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 문자열을 Level 로 (실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static boolean flag(String key) {
        return !"false".equalsIgnoreCase(System.getProperty(key, "true"));
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL %2$-7s [%3$s] %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    shortName(r.getLoggerName()), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw;
        }

        private static String shortName(String logger) {
            if (logger == null) return "";
            int dot = logger.lastIndexOf('.');
            return dot < 0 ? logger : logger.substring(dot + 1);
        }
    }
}
