package com.webauditai.core.api;

import com.webauditai.core.model.FetchResult;

/** 페이지 수집 최소 계약: 전송 실패도 예외 대신 FetchResult.error 로 돌려준다. */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(String url);
    @Override default void close() {}
}
