package com.webauditai.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AuditCliTest {

    @TempDir Path tmp;

    @Test
    void parses_url_and_flags_in_any_order() {
        AuditCli.Options o = AuditCli.parse(new String[]{
                "--out", "reports", "https://acme.example", "--competitor", "https://rival.example",
                "--config", "cfg/audit.yml"});
        assertEquals("https://acme.example", o.url());
        assertEquals("https://rival.example", o.competitorUrl());
        assertEquals(Path.of("cfg/audit.yml"), o.configPath());
        assertEquals(Path.of("reports"), o.outDir());
    }

    @Test
    void only_url_is_required() {
        AuditCli.Options o = AuditCli.parse(new String[]{"acme.example"});
        assertEquals("acme.example", o.url());
        assertNull(o.competitorUrl());
        assertNull(o.configPath());
        assertNull(o.outDir());
    }

    @Test
    void parse_errors() {
        assertEquals("Missing <url>",
                assertThrows(IllegalArgumentException.class, () -> AuditCli.parse(new String[0])).getMessage());
        assertEquals("Unknown option: --fast",
                assertThrows(IllegalArgumentException.class,
                        () -> AuditCli.parse(new String[]{"https://a.example", "--fast"})).getMessage());
        assertEquals("Unexpected argument: https://b.example",
                assertThrows(IllegalArgumentException.class,
                        () -> AuditCli.parse(new String[]{"https://a.example", "https://b.example"})).getMessage());
        assertEquals("Missing value for --competitor",
                assertThrows(IllegalArgumentException.class,
                        () -> AuditCli.parse(new String[]{"https://a.example", "--competitor"})).getMessage());
        assertEquals("Missing value for --out",
                assertThrows(IllegalArgumentException.class,
                        () -> AuditCli.parse(new String[]{"https://a.example", "--out", "--config"})).getMessage());
    }

    @Test
    void usage_error_exit_code() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = AuditCli.run(new String[0], new PrintStream(out), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(AuditCli.EXIT_USAGE, code);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Missing <url>").contains(AuditCli.USAGE);
        assertEquals(0, out.size());
    }

    @Test
    void missing_config_file_is_usage_error() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code = AuditCli.run(
                new String[]{"https://acme.example", "--config", tmp.resolve("absent.yml").toString()},
                new PrintStream(new ByteArrayOutputStream()), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(AuditCli.EXIT_USAGE, code);
        assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("Config error: audit.yml not found at:");
    }
}
