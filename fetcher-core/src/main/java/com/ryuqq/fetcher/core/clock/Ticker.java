package com.ryuqq.fetcher.core.clock;

/**
 * 단조 증가(monotonic) 시계.
 *
 * <p>경과 시간 계산 전용입니다. 벽시계 시각이 필요한 곳에는 사용하지 않습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * {@link System#nanoTime()} 기반 시스템 구현.
     */
    Ticker SYSTEM = System::nanoTime;

    /**
     * 현재 시각 (나노초, 임의 기준점).
     *
     * @return 나노초 단위 단조 시각
     */
    long read();
}
