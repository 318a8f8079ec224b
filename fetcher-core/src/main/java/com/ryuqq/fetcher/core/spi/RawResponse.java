package com.ryuqq.fetcher.core.spi;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Connection Context가 반환하는 원시 HTTP 응답.
 *
 * <p>상태 코드 분류(429/503, 4xx/5xx)는 엔진의 책임이며,
 * Connection Context는 어떤 상태 코드든 그대로 반환해야 합니다.</p>
 *
 * @param statusCode HTTP 상태 코드
 * @param headers 응답 헤더 (키 대소문자 무시)
 * @param body 응답 본문 원본 바이트
 * @param text 응답 charset으로 디코딩한 본문 (charset 미지정 시 UTF-8)
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public record RawResponse(
    int statusCode,
    Map<String, String> headers,
    byte[] body,
    String text
) {

    /**
     * Compact Constructor.
     */
    public RawResponse {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
        text = text == null ? "" : text;
    }

    /**
     * 헤더 값 조회 (대소문자 무시).
     *
     * @param name 헤더 이름
     * @return 헤더 값, 없으면 null
     */
    public String header(String name) {
        return headers.get(name);
    }

    /**
     * Content-Type 헤더 값.
     *
     * @return Content-Type, 없으면 빈 문자열
     */
    public String contentType() {
        String value = headers.get("Content-Type");
        return value == null ? "" : value;
    }
}
