package com.webauditai.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 보고서 경로 규칙: <out>/reports/<host>/audit-<slug>-<yyyyMMdd-HHmm>.json */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    public static final String PREFIX = "audit-";

    public static ReportContext context(Path baseDir, String url, Instant fetchedAt) {
        Path out = (baseDir == null ? Path.of("out") : baseDir);
        return new ReportContext(out, extractHost(url), makeSlug(url), fetchedAt == null ? Instant.now() : fetchedAt);
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.fetchedAt()); }
    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports").resolve(ctx.host()); }
    public static Path jsonPath(ReportContext ctx) { return reportsDir(ctx).resolve(filePrefix(ctx) + ".json"); }

    public static String filePrefix(ReportContext ctx) {
        return PREFIX + ctx.slug() + "-" + timestamp(ctx);
    }

    public record ReportContext(Path baseDir, String host, String slug, Instant fetchedAt) {}

    // ===== helpers =====
    static String extractHost(String url) {
        try {
            String h = URI.create(url.trim()).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (RuntimeException e) {
            return "unknown-host";
        }
    }

    static String makeSlug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("-{2,}", "-").replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
