package com.ryuqq.fetcher.core.retry;

import com.ryuqq.fetcher.core.clock.Sleeper;
import com.ryuqq.fetcher.core.clock.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 결과 기반 재시도 실행기.
 *
 * <p>작업(operation)을 실행하고, 결과가 재시도 조건(retryable)을 만족하면
 * {@link RetryPolicy}의 backoff 간격만큼 대기 후 다시 실행합니다.
 * 예외가 아닌 반환값으로 실패를 판단하므로, 작업은 실패를 값으로 표현해야 합니다.</p>
 *
 * <p><strong>중단 조건 (먼저 도달한 쪽):</strong></p>
 * <ol>
 *   <li>결과가 재시도 대상이 아님 (성공 또는 영구 실패)</li>
 *   <li>시도 횟수가 maxAttempts에 도달</li>
 *   <li>첫 시도부터의 경과 시간이 maxElapsed에 도달</li>
 *   <li>backoff 대기 중 인터럽트 발생 (인터럽트 플래그 복원)</li>
 * </ol>
 *
 * <p>backoff 대기 시간은 남은 시간 예산을 넘지 않도록 잘립니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Retrier retrier = new Retrier(new RetryPolicy());
 * Supplier<FetchOutcome> guarded = retrier.wrap(
 *     () -> attempt(url),
 *     outcome -> outcome instanceof FetchError error && error.isRetryable()
 * );
 * FetchOutcome outcome = guarded.get();
 * }</pre>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class Retrier {

    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Ticker ticker;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public Retrier(RetryPolicy policy) {
        this(policy, Sleeper.SYSTEM, Ticker.SYSTEM);
    }

    /**
     * 생성자 (대기 프리미티브와 시계 주입).
     *
     * @param policy 재시도 정책
     * @param sleeper 대기 프리미티브
     * @param ticker 단조 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Retrier(RetryPolicy policy, Sleeper sleeper, Ticker ticker) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.policy = policy;
        this.sleeper = sleeper;
        this.ticker = ticker;
    }

    /**
     * 재시도 로직으로 감싼 Supplier 반환.
     *
     * @param operation 실행할 작업
     * @param retryable 결과가 재시도 대상인지 판단하는 조건
     * @param <T> 결과 타입
     * @return 호출 시 재시도 정책에 따라 작업을 실행하는 Supplier
     */
    public <T> Supplier<T> wrap(Supplier<T> operation, Predicate<? super T> retryable) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }
        return () -> execute(operation, retryable);
    }

    /**
     * 재시도 정책에 따라 작업 실행.
     *
     * @param operation 실행할 작업
     * @param retryable 결과가 재시도 대상인지 판단하는 조건
     * @param <T> 결과 타입
     * @return 마지막 시도의 결과
     */
    public <T> T execute(Supplier<T> operation, Predicate<? super T> retryable) {
        long startNanos = ticker.read();
        long budgetNanos = policy.maxElapsed().toNanos();
        int attempt = 0;

        while (true) {
            attempt++;
            T result = operation.get();

            if (!retryable.test(result)) {
                return result;
            }
            if (attempt >= policy.maxAttempts()) {
                log.warn("Giving up after {} tries (max attempts reached): {}", attempt, result);
                return result;
            }

            long remainingNanos = budgetNanos - (ticker.read() - startNanos);
            if (remainingNanos <= 0) {
                log.warn("Giving up after {} tries (max elapsed {} reached): {}",
                    attempt, policy.maxElapsed(), result);
                return result;
            }

            Duration delay = policy.backoff().calculate(attempt);
            if (delay.toNanos() > remainingNanos) {
                delay = Duration.ofNanos(remainingNanos);
            }

            log.warn("Backing off {} ms after {} tries: {}", delay.toMillis(), attempt, result);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry interrupted after {} tries: {}", attempt, result);
                return result;
            }
        }
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
