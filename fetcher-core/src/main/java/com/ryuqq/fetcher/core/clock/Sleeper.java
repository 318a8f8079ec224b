package com.ryuqq.fetcher.core.clock;

import java.time.Duration;

/**
 * 대기(suspension) 프리미티브.
 *
 * <p>Rate Limiter 대기와 재시도 backoff 대기가 모두 이 인터페이스를 통해 이루어집니다.
 * 테스트에서는 실제로 잠들지 않고 가상 시계를 전진시키는 구현으로 교체합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * {@link Thread#sleep(long, int)} 기반 시스템 구현.
     */
    Sleeper SYSTEM = duration -> {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        long nanos = duration.toNanos();
        Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
    };

    /**
     * 지정한 시간만큼 현재 스레드를 대기시킵니다.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;
}
