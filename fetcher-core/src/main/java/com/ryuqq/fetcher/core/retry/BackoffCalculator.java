package com.ryuqq.fetcher.core.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 시도마다 두 배로 늘리고, Jitter를 더해
 * 같은 배치의 Fetch들이 동시에 재시도하는 현상을 완화합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 1000-1100ms</li>
 *   <li>attemptCount=2: 2000-2200ms</li>
 *   <li>attemptCount=3: 4000-4400ms</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=60000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(1000, 60000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Jitter 없는 고정 배수 backoff 생성 (테스트 및 예측 가능한 스케줄용).
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초)
     * @param maxDelayMs 최대 지연 시간 (밀리초)
     * @return Jitter 비율이 0인 BackoffCalculator
     */
    public static BackoffCalculator withoutJitter(long baseDelayMs, long maxDelayMs) {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, 0.0);
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 실패한 시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public Duration calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 1. 지수적 백오프 (overflow 방지를 위해 maxDelay 초과 여부를 먼저 확인)
        int shift = Math.min(attemptCount - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        // 3. 최대값 제한
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
