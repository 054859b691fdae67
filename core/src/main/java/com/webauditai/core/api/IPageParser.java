package com.webauditai.core.api;

import com.webauditai.core.model.ParsedPage;

/** HTML 파싱 최소 계약: 깨진 마크업도 관대하게 처리한다. */
public interface IPageParser {
    ParsedPage parse(String html, String baseUrl);
}
