package com.webauditai.core.api;

import com.webauditai.core.model.Category;
import com.webauditai.core.model.CategoryResult;
import com.webauditai.core.model.FetchResult;
import com.webauditai.core.model.PageSnapshot;
import com.webauditai.core.model.ParsedPage;

/**
 * 분석기 계약. 입력은 읽기 전용이고 상태를 공유하지 않으므로 순서/동시 실행 무관.
 * 정상 입력에 대해 예외를 던지지 않으며 점수는 [0,100].
 */
public interface IAnalyzer {

    Category category();

    CategoryResult analyze(ParsedPage page, FetchResult fetch);

    /** 경쟁 페이지 비교를 지원하지 않는 분석기는 competitor 를 무시한다. */
    default CategoryResult analyze(ParsedPage page, FetchResult fetch, PageSnapshot competitor) {
        return analyze(page, fetch);
    }
}
