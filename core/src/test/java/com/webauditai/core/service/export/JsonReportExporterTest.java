package com.webauditai.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webauditai.core.model.AuditResult;
import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.Issue;
import com.webauditai.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JsonReportExporterTest {

    @TempDir Path tmp;

    private static AuditResult sample() {
        Issue issue = Issue.builder()
                .id("images-no-alt").category(Category.IMAGES).severity(Severity.HIGH)
                .title("Images missing alt text").recommendation("Add descriptive alt text.")
                .build();
        CategoryResult images = CategoryResult.builder(Category.IMAGES)
                .score(80).weight(0.05).issues(List.of(issue)).summary("1 issue")
                .build();
        return AuditResult.builder()
                .overallScore(80)
                .categories(List.of(images))
                .topFixes(List.of(issue))
                .url("https://acme.example/guide")
                .domain("acme.example")
                .fetchedAt(Instant.parse("2026-03-01T10:15:30Z"))
                .auditDurationMs(42)
                .pageTitle("Guide")
                .build();
    }

    @Test
    void writes_report_under_host_dir() throws Exception {
        Path out = new JsonReportExporter().export(tmp, sample());

        assertTrue(Files.exists(out));
        assertEquals(tmp.resolve("reports").resolve("acme.example"), out.getParent());
        assertThat(out.getFileName().toString()).startsWith("audit-acme.example-guide-").endsWith(".json");
    }

    @Test
    void json_shape() throws Exception {
        Path out = new JsonReportExporter().export(tmp, sample());
        JsonNode root = new ObjectMapper().readTree(Files.readString(out, StandardCharsets.UTF_8));

        assertEquals(80, root.get("overallScore").asInt());
        assertEquals("2026-03-01T10:15:30Z", root.get("fetchedAt").asText());
        assertEquals("images", root.at("/categories/0/name").asText());
        assertEquals("Image Optimization", root.at("/categories/0/label").asText());
        assertEquals("high", root.at("/topFixes/0/severity").asText());
        assertEquals("images", root.at("/topFixes/0/category").asText());

        assertFalse(root.has("failed"));
        assertFalse(root.has("error"));
        assertFalse(root.at("/categories/0").has("geoDetails"));
        assertFalse(root.at("/categories/0").has("category"));
    }

    @Test
    void failure_result_keeps_error_and_empty_lists() throws Exception {
        AuditResult failed = AuditResult.failure("https://down.example/", "down.example",
                "Connection refused", Instant.EPOCH, 5);
        String json = new JsonReportExporter().toJson(failed);
        JsonNode root = new ObjectMapper().readTree(json);

        assertEquals("Connection refused", root.get("error").asText());
        assertEquals(0, root.get("overallScore").asInt());
        assertEquals(0, root.get("categories").size());
    }

    @Test
    void overwrite_same_minute() throws Exception {
        JsonReportExporter ex = new JsonReportExporter();
        Path first = ex.export(tmp, sample());
        Path second = ex.export(tmp, sample());
        assertEquals(first, second);
        try (var files = Files.list(first.getParent())) {
            assertEquals(1, files.count());
        }
    }
}
