package com.webauditai.core.service.export;

import static com.webauditai.core.service.export.ReportNaming.context;
import static com.webauditai.core.service.export.ReportNaming.jsonPath;
import static com.webauditai.core.service.export.ReportNaming.reportsDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.webauditai.core.model.AuditResult;
import com.webauditai.core.util.JsonSupport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * AuditResult → JSON 파일. ISO-8601 타임스탬프, null 필드 생략, 들여쓰기 출력.
 */
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper mapper;

    public JsonReportExporter() {
        this.mapper = JsonSupport.newMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path export(Path baseDir, AuditResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        var ctx = context(baseDir, result.getUrl(), result.getFetchedAt());
        Files.createDirectories(reportsDir(ctx));
        Path outFile = jsonPath(ctx);

        Files.writeString(outFile, toJson(result), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    public String toJson(AuditResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }
}
