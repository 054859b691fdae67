package com.webauditai.core.model;

import java.util.Objects;

/** fetch + parse 한 쌍. 경쟁 페이지 비교 입력으로 쓴다. */
public record PageSnapshot(ParsedPage page, FetchResult fetch) {
    public PageSnapshot {
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(fetch, "fetch");
    }
}
