package com.webauditai.app;

import com.webauditai.core.config.AuditConfig;
import com.webauditai.core.config.YamlConfigLoader;
import com.webauditai.core.model.AuditResult;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.Issue;
import com.webauditai.core.service.AuditService;
import com.webauditai.core.service.export.JsonReportExporter;
import com.webauditai.core.util.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;

/**
 * webauditai &lt;url&gt; [--competitor &lt;url&gt;] [--config audit.yml] [--out dir]
 *
 * 종료 코드: 0 성공, 1 감사 실패/보고서 쓰기 실패, 2 인자/설정 오류.
 * System props: -Dwebaudit.log.level=FINE|INFO|WARNING (기본 INFO)
 */
public final class AuditCli {

    private static final Logger LOG = LoggerFactory.getLogger(AuditCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_AUDIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
            "usage: webauditai <url> [--competitor <url>] [--config audit.yml] [--out dir]";

    /** 파싱된 인자 */
    record Options(String url, String competitorUrl, Path configPath, Path outDir) {}

    private AuditCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options opts;
        try {
            opts = parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        AuditConfig cfg;
        try {
            cfg = (opts.configPath() != null) ? YamlConfigLoader.load(opts.configPath()) : YamlConfigLoader.loadDefault();
        } catch (IOException | RuntimeException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_USAGE;
        }
        Path outDir = (opts.outDir() != null) ? opts.outDir() : cfg.getOutputDir();

        LoggingConfigurator.init(outDir.resolve("logs"), logLevel(), 2 * 1024 * 1024, 5);

        AuditResult result;
        try (AuditService service = new AuditService(cfg)) {
            result = service.runAudit(opts.url(), opts.competitorUrl(),
                    (step, percent) -> out.printf(Locale.ROOT, "[%3d%%] %s%n", percent, step));
        }

        Path report = null;
        try {
            report = new JsonReportExporter().export(outDir, result);
        } catch (IOException e) {
            LOG.error("Report export failed", e);
            err.println("Report export failed: " + e.getMessage());
        }

        printSummary(out, result, report);
        if (result.isFailed()) {
            err.println("Audit failed: " + result.getError());
            return EXIT_AUDIT_FAILED;
        }
        return (report == null) ? EXIT_AUDIT_FAILED : EXIT_OK;
    }

    static Options parse(String[] args) {
        String url = null;
        String competitor = null;
        Path config = null;
        Path out = null;
        if (args == null) args = new String[0];
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--competitor" -> competitor = value(args, ++i, a);
                case "--config" -> config = Path.of(value(args, ++i, a));
                case "--out" -> out = Path.of(value(args, ++i, a));
                default -> {
                    if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (url != null) throw new IllegalArgumentException("Unexpected argument: " + a);
                    url = a;
                }
            }
        }
        if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing <url>");
        return new Options(url, competitor, config, out);
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[i];
    }

    private static Level logLevel() {
        try {
            return Level.parse(System.getProperty("webaudit.log.level", "INFO").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    private static void printSummary(PrintStream out, AuditResult r, Path report) {
        out.println();
        out.printf(Locale.ROOT, "%s  overall %d/100%n", r.getUrl(), r.getOverallScore());
        for (CategoryResult c : r.getCategories()) {
            out.printf(Locale.ROOT, "  %-26s %3d  (%d issues)%n", c.getLabel(), c.getScore(), c.getIssues().size());
        }
        if (!r.getTopFixes().isEmpty()) {
            out.println("Top fixes:");
            int n = 1;
            for (Issue i : r.getTopFixes()) {
                out.printf(Locale.ROOT, "  %2d. [%s] %s%n", n++, i.getSeverity().key(), i.getTitle());
            }
        }
        if (report != null) out.println("Report: " + report.toAbsolutePath());
    }
}
