package com.ryuqq.fetcher.core.retry;

import com.ryuqq.fetcher.core.clock.Sleeper;
import com.ryuqq.fetcher.core.clock.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Retrier 유닛 테스트.
 *
 * <p>가상 시계를 사용하므로 실제 대기 없이 backoff 스케줄을 검증합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
class RetrierTest {

    private static final String FAIL = "fail";
    private static final String OK = "ok";

    private AtomicLong now;
    private List<Duration> sleeps;
    private Ticker ticker;
    private Sleeper sleeper;

    @BeforeEach
    void setUp() {
        now = new AtomicLong();
        sleeps = new ArrayList<>();
        ticker = now::get;
        sleeper = duration -> {
            sleeps.add(duration);
            now.addAndGet(duration.toNanos());
        };
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private Retrier retrier(int maxAttempts, Duration maxElapsed) {
        RetryPolicy policy = new RetryPolicy(maxAttempts, maxElapsed, BackoffCalculator.withoutJitter(1000, 60000));
        return new Retrier(policy, sleeper, ticker);
    }

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void 첫_시도_성공이면_재시도하지_않는다() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> guarded = retrier(3, Duration.ofSeconds(90))
            .wrap(() -> { calls.incrementAndGet(); return OK; }, FAIL::equals);

        // when
        String result = guarded.get();

        // then
        assertThat(result).isEqualTo(OK);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void 일시_실패_후_성공하면_성공_결과를_반환한다() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> operation = () -> calls.incrementAndGet() < 3 ? FAIL : OK;

        // when
        String result = retrier(3, Duration.ofSeconds(90)).execute(operation, FAIL::equals);

        // then
        assertThat(result).isEqualTo(OK);
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000));
    }

    // ============================================================
    // 2. 중단 조건
    // ============================================================

    @Test
    void 최대_시도_횟수에서_중단하고_마지막_실패를_반환한다() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> operation = () -> FAIL + calls.incrementAndGet();

        // when
        String result = retrier(3, Duration.ofSeconds(90)).execute(operation, r -> r.startsWith(FAIL));

        // then
        assertThat(result).isEqualTo("fail3");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void 재시도_대상이_아닌_결과는_즉시_반환한다() {
        AtomicInteger calls = new AtomicInteger();

        String result = retrier(5, Duration.ofSeconds(90))
            .execute(() -> { calls.incrementAndGet(); return "permanent"; }, FAIL::equals);

        assertThat(result).isEqualTo("permanent");
        assertThat(calls).hasValue(1);
    }

    @Test
    void 누적_시간_예산을_넘으면_중단한다() {
        // given: 시도당 2초 소요, 예산 5초
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> slowFailure = () -> {
            calls.incrementAndGet();
            now.addAndGet(Duration.ofSeconds(2).toNanos());
            return FAIL;
        };

        // when
        String result = retrier(100, Duration.ofSeconds(5)).execute(slowFailure, FAIL::equals);

        // then: 0-2s 시도, 1s 대기, 3-5s 시도, 예산 소진
        assertThat(result).isEqualTo(FAIL);
        assertThat(calls).hasValue(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(1000));
    }

    @Test
    void backoff_대기는_남은_예산으로_잘린다() {
        // given: 예산 2.5초, backoff 1s, 2s
        AtomicInteger calls = new AtomicInteger();

        // when
        retrier(10, Duration.ofMillis(2500)).execute(() -> { calls.incrementAndGet(); return FAIL; }, FAIL::equals);

        // then
        assertThat(sleeps).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(1500));
        assertThat(calls).hasValue(3);
    }

    @Test
    void 대기중_인터럽트되면_플래그를_복원하고_마지막_결과를_반환한다() {
        // given
        Sleeper interrupting = duration -> {
            throw new InterruptedException("cancelled");
        };
        Retrier retrier = new Retrier(new RetryPolicy(), interrupting, ticker);
        AtomicInteger calls = new AtomicInteger();

        // when
        String result = retrier.execute(() -> { calls.incrementAndGet(); return FAIL; }, FAIL::equals);

        // then
        assertThat(result).isEqualTo(FAIL);
        assertThat(calls).hasValue(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    // ============================================================
    // 3. 입력 검증
    // ============================================================

    @Test
    void null_인자는_예외() {
        Retrier retrier = new Retrier(new RetryPolicy());

        assertThatThrownBy(() -> new Retrier(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retrier.wrap(null, r -> false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retrier.wrap(() -> OK, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
