package com.webauditai.core.service.export;

import com.webauditai.core.model.AuditResult;

import java.nio.file.Path;

/** 감사 결과를 보고서 파일로 내보내는 책임 (확장: JSON 외 포맷) */
public interface ReportExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @param result  감사 결과(실패 결과 포함)
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, AuditResult result) throws Exception;
}
