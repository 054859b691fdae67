package com.webauditai.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.webauditai.core.insight.InsightPrompt;

import java.util.Optional;

/**
 * 외부 LLM 정성 평가. 어떤 실패(키 없음/타임아웃/비JSON 응답)도 Optional.empty() 로 돌려준다.
 * 반환되는 노드는 항상 JSON object.
 */
@FunctionalInterface
public interface IInsightProvider {

    Optional<JsonNode> infer(InsightPrompt prompt, String text, String url, String title);

    IInsightProvider UNAVAILABLE = (prompt, text, url, title) -> Optional.empty();
}
