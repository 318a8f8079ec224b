package com.ryuqq.fetcher.core.protection;

import com.ryuqq.fetcher.core.model.FetchDefaults;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * <p>초당 요청 수로부터 요청 간 최소 간격({@code 1 / requestsPerSecond})을 도출합니다.</p>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #STANDARD}: 초당 5회 (최소 간격 200ms)</li>
 *   <li>{@link #HIGH_THROUGHPUT}: 초당 250회 (최소 간격 4ms)</li>
 * </ul>
 *
 * <p>두 프리셋 사이의 기본값은 정하지 않습니다. 호출자가 명시적으로 선택합니다.</p>
 *
 * @param requestsPerSecond 초당 허용 요청 수 (예: 5.0)
 * @author Fetcher Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double requestsPerSecond) {

    /** 표준 프로필: 초당 5회. */
    public static final RateLimiterConfig STANDARD = new RateLimiterConfig(FetchDefaults.DEFAULT_REQUESTS_PER_SECOND);

    /** 고처리량 프로필: 초당 250회. */
    public static final RateLimiterConfig HIGH_THROUGHPUT = new RateLimiterConfig(FetchDefaults.HIGH_THROUGHPUT_REQUESTS_PER_SECOND);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if requestsPerSecond is not a positive finite number
     */
    public RateLimiterConfig {
        if (Double.isNaN(requestsPerSecond) || Double.isInfinite(requestsPerSecond) || requestsPerSecond <= 0) {
            throw new IllegalArgumentException(
                "requestsPerSecond must be positive (current: " + requestsPerSecond + ")"
            );
        }
    }

    /**
     * 요청 간 최소 간격.
     *
     * @return 최소 간격
     */
    public Duration minInterval() {
        return Duration.ofNanos(minIntervalNanos());
    }

    /**
     * 요청 간 최소 간격 (나노초).
     *
     * @return 최소 간격 나노초
     */
    public long minIntervalNanos() {
        return (long) (1_000_000_000L / requestsPerSecond);
    }
}
