package com.ryuqq.fetcher.core.retry;

import com.ryuqq.fetcher.core.model.FetchDefaults;

import java.time.Duration;

/**
 * 재시도 정책 (불변 record).
 *
 * <p>시도 횟수 상한과 누적 경과 시간 상한 중 먼저 도달한 쪽이 재시도를 중단시킵니다.
 * 중단 시점의 마지막 실패가 최종 결과가 됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>maxElapsed: 첫 시도부터의 최대 누적 시간 (기본 90초)</li>
 *   <li>backoff: 재시도 간격 계산기 (기본 1초부터 두 배씩)</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param maxElapsed 최대 누적 시간 (양수)
 * @param backoff 백오프 계산기
 */
public record RetryPolicy(
    int maxAttempts,
    Duration maxElapsed,
    BackoffCalculator backoff
) {

    public static final int DEFAULT_MAX_ATTEMPTS = FetchDefaults.DEFAULT_MAX_ATTEMPTS;
    public static final Duration DEFAULT_MAX_ELAPSED = FetchDefaults.DEFAULT_MAX_RETRY_TIME;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, maxElapsed=90s, backoff=BackoffCalculator()</p>
     */
    public RetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_ELAPSED, new BackoffCalculator());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (maxElapsed == null || maxElapsed.isZero() || maxElapsed.isNegative()) {
            throw new IllegalArgumentException(
                "maxElapsed must be positive (current: " + maxElapsed + ")"
            );
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
    }

    /**
     * 재시도 없이 한 번만 시도하는 정책.
     *
     * @return maxAttempts=1 정책
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy().withMaxAttempts(1);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, maxElapsed, backoff);
    }

    /**
     * maxElapsed만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxElapsed(Duration maxElapsed) {
        return new RetryPolicy(maxAttempts, maxElapsed, backoff);
    }

    /**
     * backoff만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBackoff(BackoffCalculator backoff) {
        return new RetryPolicy(maxAttempts, maxElapsed, backoff);
    }
}
