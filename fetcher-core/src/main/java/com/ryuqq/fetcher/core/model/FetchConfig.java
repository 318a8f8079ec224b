package com.ryuqq.fetcher.core.model;

import com.ryuqq.fetcher.core.protection.IntervalRateLimiter;
import com.ryuqq.fetcher.core.protection.RateLimiter;
import com.ryuqq.fetcher.core.protection.RateLimiterConfig;
import com.ryuqq.fetcher.core.protection.noop.NoOpRateLimiter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetch 요청 설정 (불변 record).
 *
 * <p>각 Fetch 호출에 값으로 전달되며, 엔진은 이를 변경하지 않습니다.
 * 변경이 필요하면 {@code withXxx} 메서드로 새 인스턴스를 만듭니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>customHeaders: 요청 헤더 (비어 있으면 {@link FetchDefaults#DEFAULT_HTTP_HEADERS} 사용)</li>
 *   <li>queryParams: 쿼리 파라미터</li>
 *   <li>cookies: 쿠키</li>
 *   <li>timeout: 요청 타임아웃 (기본 30초)</li>
 *   <li>followRedirects: 리다이렉트 추적 여부 (기본 true)</li>
 *   <li>verifyTls: TLS 인증서 검증 여부 (기본 true)</li>
 *   <li>expectedContentType: 기대 Content-Type, 부분 문자열 일치 (선택, null 가능)</li>
 *   <li>proxy: 프록시 URL, 예: {@code http://proxy.local:8080} (선택, null 가능)</li>
 *   <li>rateLimiter: 공유 Rate Limiter (기본 {@link NoOpRateLimiter}, 즉 비제한)</li>
 * </ul>
 *
 * <p><strong>프로필:</strong></p>
 * <ul>
 *   <li>{@link #defaults()}: 비제한 모드</li>
 *   <li>{@link #standardProfile()}: 초당 5회 제한</li>
 *   <li>{@link #highThroughputProfile()}: 초당 250회 제한</li>
 * </ul>
 * <p>프로필 메서드는 호출할 때마다 새로운 Rate Limiter를 생성하므로,
 * 서로 다른 호출자가 의도치 않게 Rate Limiter 상태를 공유하지 않습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 * @param customHeaders 요청 헤더
 * @param queryParams 쿼리 파라미터
 * @param cookies 쿠키
 * @param timeout 요청 타임아웃 (양수)
 * @param followRedirects 리다이렉트 추적 여부
 * @param verifyTls TLS 인증서 검증 여부
 * @param expectedContentType 기대 Content-Type (null 가능)
 * @param proxy 프록시 URL (null 가능)
 * @param rateLimiter Rate Limiter
 */
public record FetchConfig(
    Map<String, String> customHeaders,
    Map<String, String> queryParams,
    Map<String, String> cookies,
    Duration timeout,
    boolean followRedirects,
    boolean verifyTls,
    String expectedContentType,
    String proxy,
    RateLimiter rateLimiter
) {

    /**
     * 기본 설정 생성자 (비제한 모드).
     *
     * <p>기본값: 헤더/쿼리/쿠키 없음, timeout=30s, followRedirects=true, verifyTls=true,
     * expectedContentType=null, proxy=null, rateLimiter=NoOp</p>
     */
    public FetchConfig() {
        this(Map.of(), Map.of(), Map.of(), FetchDefaults.DEFAULT_REQUEST_TIMEOUT,
            true, true, null, null, NoOpRateLimiter.INSTANCE);
    }

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FetchConfig {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (expectedContentType != null && expectedContentType.isBlank()) {
            expectedContentType = null;
        }
        if (proxy != null && proxy.isBlank()) {
            proxy = null;
        }
        customHeaders = copyOf(customHeaders);
        queryParams = copyOf(queryParams);
        cookies = copyOf(cookies);
        rateLimiter = rateLimiter == null ? NoOpRateLimiter.INSTANCE : rateLimiter;
    }

    /**
     * 비제한 기본 설정.
     *
     * @return 새 기본 설정
     */
    public static FetchConfig defaults() {
        return new FetchConfig();
    }

    /**
     * 표준 프로필 (초당 5회, 새 Rate Limiter).
     *
     * @return 표준 프로필 설정
     */
    public static FetchConfig standardProfile() {
        return defaults().withRateLimiter(new IntervalRateLimiter(RateLimiterConfig.STANDARD));
    }

    /**
     * 고처리량 프로필 (초당 250회, 새 Rate Limiter).
     *
     * @return 고처리량 프로필 설정
     */
    public static FetchConfig highThroughputProfile() {
        return defaults().withRateLimiter(new IntervalRateLimiter(RateLimiterConfig.HIGH_THROUGHPUT));
    }

    /**
     * 실제로 전송할 헤더.
     *
     * @return customHeaders가 비어 있으면 기본 헤더 세트, 아니면 customHeaders
     */
    public Map<String, String> effectiveHeaders() {
        return customHeaders.isEmpty() ? FetchDefaults.DEFAULT_HTTP_HEADERS : customHeaders;
    }

    /**
     * Content-Type 검사 여부.
     *
     * @return expectedContentType이 지정되어 있으면 true
     */
    public boolean hasExpectedContentType() {
        return expectedContentType != null;
    }

    /**
     * customHeaders만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withCustomHeaders(Map<String, String> customHeaders) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * queryParams만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withQueryParams(Map<String, String> queryParams) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * cookies만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withCookies(Map<String, String> cookies) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withTimeout(Duration timeout) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * followRedirects만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withFollowRedirects(boolean followRedirects) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * verifyTls만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withVerifyTls(boolean verifyTls) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * expectedContentType만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withExpectedContentType(String expectedContentType) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * proxy만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withProxy(String proxy) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    /**
     * rateLimiter만 변경한 새 인스턴스 생성.
     */
    public FetchConfig withRateLimiter(RateLimiter rateLimiter) {
        return new FetchConfig(customHeaders, queryParams, cookies, timeout,
            followRedirects, verifyTls, expectedContentType, proxy, rateLimiter);
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
