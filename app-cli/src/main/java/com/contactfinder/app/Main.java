package com.contactfinder.app;

import com.contactfinder.app.logging.LogSetup;
import com.contactfinder.app.server.StatusServer;
import com.contactfinder.core.export.ResultWriter;
import com.contactfinder.core.model.CrawlResult;
import com.contactfinder.core.model.CrawlerConfig;
import com.contactfinder.core.service.ContactCrawlService;
import com.contactfinder.core.service.CrawlJobManager;
import com.contactfinder.core.service.CrawlRunException;
import com.contactfinder.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;

// CLI entry point: crawl (기본) 또는 serve
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
            Usage: contact-finder [crawl|serve] [options]

              crawl                     crawl the member directory and write results (default)
              serve                     start the status UI and API

            Options:
              --config FILE             YAML config (default: ./crawler.yml if present)
              --directory-url URL       member directory page to start from
              --delay SECONDS           delay between requests (decimals allowed)
              --timeout SECONDS         timeout for each request
              --output FILE             output path (.csv or .json)
              --port N                  serve only, default 8000
              -v, --verbose             debug logging
              -h, --help                show this help
            """;

    private Main() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options o;
        try {
            o = parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (o.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        CrawlerConfig cfg;
        try {
            cfg = resolveConfig(o);
        } catch (IOException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("Invalid configuration: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        LogSetup.init(Path.of("logs"));
        if (o.verbose) LogSetup.setLevel(Level.FINE);

        return o.command.equals("serve") ? serve(cfg, o.port, err) : crawl(cfg, out, err);
    }

    /* =========================
       commands
       ========================= */

    private static int crawl(CrawlerConfig cfg, PrintStream out, PrintStream err) {
        try {
            List<CrawlResult> results = new ContactCrawlService(cfg).run();
            Path written = ResultWriter.forPath(cfg.getOutput()).write(results, cfg.getOutput());
            out.println("Done. Wrote " + written);
            return EXIT_OK;
        } catch (CrawlRunException e) {
            err.println("Crawl failed: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            err.println("Failed to write results: " + e.getMessage());
            return EXIT_FAILED;
        } catch (CancellationException e) {
            err.println("Crawl interrupted");
            return EXIT_FAILED;
        }
    }

    private static int serve(CrawlerConfig defaults, int port, PrintStream err) {
        CountDownLatch stopped = new CountDownLatch(1);
        try {
            CrawlJobManager jobs = new CrawlJobManager();
            StatusServer server = new StatusServer(jobs, defaults, port);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                jobs.close();
                stopped.countDown();
            }, "shutdown"));
            server.start();
            stopped.await();
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Cannot start server on port " + port + ": " + e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_OK;
        }
    }

    /* =========================
       args → options → config
       ========================= */

    static final class Options {
        String command = "crawl";
        Path config;
        String directoryUrl;
        Double delaySeconds;
        Double timeoutSeconds;
        Path output;
        int port = 8000;
        boolean verbose;
        boolean help;
    }

    static final class UsageException extends Exception {
        UsageException(String message) { super(message); }
    }

    static Options parse(String[] args) throws UsageException {
        Options o = new Options();
        int i = 0;
        if (args.length > 0 && !args[0].startsWith("-")) {
            if (!args[0].equals("crawl") && !args[0].equals("serve")) {
                throw new UsageException("Unknown command: " + args[0]);
            }
            o.command = args[0];
            i = 1;
        }

        for (; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config" -> o.config = Path.of(value(args, ++i, a));
                case "--directory-url" -> o.directoryUrl = value(args, ++i, a);
                case "--delay" -> o.delaySeconds = parseDouble(value(args, ++i, a), a);
                case "--timeout" -> o.timeoutSeconds = parseDouble(value(args, ++i, a), a);
                case "--output" -> o.output = Path.of(value(args, ++i, a));
                case "--port" -> o.port = parsePort(value(args, ++i, a));
                case "-v", "--verbose" -> o.verbose = true;
                case "-h", "--help" -> o.help = true;
                default -> throw new UsageException("Unknown option: " + a);
            }
        }
        return o;
    }

    /**
     * 설정 우선순위: CLI 플래그 > --config 파일 (없으면 ./crawler.yml) > 기본값.
     * @throws IOException --config 로 지정한 파일이 없거나 읽기 실패
     */
    static CrawlerConfig resolveConfig(Options o) throws IOException {
        CrawlerConfig cfg;
        if (o.config != null) {
            cfg = YamlConfigLoader.load(o.config);
        } else if (Files.exists(Path.of("crawler.yml"))) {
            cfg = YamlConfigLoader.loadDefault();
            LOG.debug("Loaded ./crawler.yml");
        } else {
            cfg = CrawlerConfig.defaults();
        }

        if (o.directoryUrl != null) cfg.setDirectoryUrl(o.directoryUrl);
        if (o.delaySeconds != null) cfg.setDelaySeconds(o.delaySeconds);
        if (o.timeoutSeconds != null) cfg.setTimeout(Duration.ofMillis(Math.round(o.timeoutSeconds * 1000.0)));
        if (o.output != null) cfg.setOutput(o.output);

        cfg.validate();
        return cfg;
    }

    private static String value(String[] args, int i, String option) throws UsageException {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new UsageException("Missing value for " + option);
        }
        return args[i];
    }

    private static double parseDouble(String s, String option) throws UsageException {
        double d;
        try {
            d = Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid number for " + option + ": " + s);
        }
        if (!Double.isFinite(d)) throw new UsageException("Invalid number for " + option + ": " + s);
        return d;
    }

    private static int parsePort(String s) throws UsageException {
        try {
            int p = Integer.parseInt(s.trim());
            if (p < 0 || p > 65535) throw new UsageException("Port out of range: " + s);
            return p;
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid port: " + s);
        }
    }
}
