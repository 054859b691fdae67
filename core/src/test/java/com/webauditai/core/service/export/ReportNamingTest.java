package com.webauditai.core.service.export;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ReportNamingTest {

    @Test
    void host_is_lowercased_and_sanitized() {
        assertEquals("www.acme.example", ReportNaming.extractHost("https://WWW.Acme.Example:8443/x"));
        assertEquals("unknown-host", ReportNaming.extractHost("not a url"));
        assertEquals("unknown-host", ReportNaming.extractHost("mailto:someone"));
    }

    @Test
    void slug_strips_scheme_and_collapses_separators() {
        assertEquals("www.acme.example-guide-x-1", ReportNaming.makeSlug("https://www.acme.example/guide?x=1"));
        assertEquals("acme.example", ReportNaming.makeSlug("http://acme.example/"));
        assertEquals("no-url", ReportNaming.makeSlug("  "));
        assertEquals("no-url", ReportNaming.makeSlug(null));
    }

    @Test
    void slug_is_capped() {
        String longUrl = "https://acme.example/" + "a".repeat(200);
        assertTrue(ReportNaming.makeSlug(longUrl).length() <= 60);
    }

    @Test
    void path_layout_under_reports_host() {
        Instant at = Instant.parse("2026-03-01T10:15:30Z");
        var ctx = ReportNaming.context(Path.of("base"), "https://acme.example/a/b", at);

        Path p = ReportNaming.jsonPath(ctx);
        assertEquals(Path.of("base", "reports", "acme.example"), p.getParent());
        String expected = "audit-acme.example-a-b-" + ReportNaming.TS_FMT.format(at) + ".json";
        assertEquals(expected, p.getFileName().toString());
    }

    @Test
    void null_base_dir_falls_back_to_out() {
        var ctx = ReportNaming.context(null, "https://acme.example/", Instant.EPOCH);
        assertEquals(Path.of("out"), ctx.baseDir());
    }
}
