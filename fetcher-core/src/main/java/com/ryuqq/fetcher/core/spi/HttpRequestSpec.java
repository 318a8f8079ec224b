package com.ryuqq.fetcher.core.spi;

import com.ryuqq.fetcher.core.model.FetchConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection Context에 전달되는 GET 요청 명세.
 *
 * <p>Connection Context 구현체는 이 명세만 보고 요청을 구성하며,
 * Rate Limiter나 재시도 같은 엔진 관심사는 포함하지 않습니다.</p>
 *
 * @param url 요청 URL (쿼리 파라미터 적용 전)
 * @param headers 요청 헤더
 * @param queryParams 쿼리 파라미터
 * @param cookies 쿠키
 * @param followRedirects 리다이렉트 추적 여부
 * @param verifyTls TLS 인증서 검증 여부
 * @param proxy 프록시 URL (null 가능)
 * @param timeout 요청 타임아웃
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public record HttpRequestSpec(
    String url,
    Map<String, String> headers,
    Map<String, String> queryParams,
    Map<String, String> cookies,
    boolean followRedirects,
    boolean verifyTls,
    String proxy,
    Duration timeout
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException url 또는 timeout이 null인 경우
     */
    public HttpRequestSpec {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        headers = orderedCopy(headers);
        queryParams = orderedCopy(queryParams);
        cookies = orderedCopy(cookies);
    }

    /**
     * FetchConfig로부터 요청 명세 생성.
     *
     * <p>customHeaders가 비어 있으면 기본 헤더 세트를 사용합니다.</p>
     *
     * @param url 요청 URL
     * @param config Fetch 설정
     * @return 요청 명세
     */
    public static HttpRequestSpec of(String url, FetchConfig config) {
        return new HttpRequestSpec(
            url,
            config.effectiveHeaders(),
            config.queryParams(),
            config.cookies(),
            config.followRedirects(),
            config.verifyTls(),
            config.proxy(),
            config.timeout()
        );
    }

    private static Map<String, String> orderedCopy(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
