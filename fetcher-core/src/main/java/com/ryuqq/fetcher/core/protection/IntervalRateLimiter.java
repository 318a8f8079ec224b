package com.ryuqq.fetcher.core.protection;

import com.ryuqq.fetcher.core.clock.Sleeper;
import com.ryuqq.fetcher.core.clock.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 최소 간격 기반 단일 슬롯 Rate Limiter.
 *
 * <p>마지막 요청 시각으로부터 {@code minInterval}이 지나지 않았다면 남은 시간만큼 대기한 뒤,
 * 대기 이후 시각을 마지막 요청 시각으로 기록합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * lock {
 *   now     = ticker.read()
 *   slot    = max(now, lastRequest + minInterval)
 *   lastRequest = slot
 * }
 * sleep(slot - now)      // lock 밖에서 대기
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>공유 가변 상태는 lastRequest 하나이며 ReentrantLock으로 보호됩니다.</li>
 *   <li>슬롯 예약이 lock 안에서 이루어지므로 동시 대기자는 minInterval 간격으로 분산됩니다.</li>
 *   <li>FIFO 공정성은 보장하지 않습니다 (lock 획득 순서에 따름).</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class IntervalRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(IntervalRateLimiter.class);

    private final RateLimiterConfig config;
    private final long minIntervalNanos;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private long lastRequestNanos;
    private boolean started;

    /**
     * 초당 요청 수로 생성 (시스템 시계 사용).
     *
     * @param requestsPerSecond 초당 허용 요청 수 (양수)
     * @throws IllegalArgumentException requestsPerSecond가 양수가 아닌 경우
     */
    public IntervalRateLimiter(double requestsPerSecond) {
        this(new RateLimiterConfig(requestsPerSecond));
    }

    /**
     * 설정으로 생성 (시스템 시계 사용).
     *
     * @param config Rate Limiter 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public IntervalRateLimiter(RateLimiterConfig config) {
        this(config, Ticker.SYSTEM, Sleeper.SYSTEM);
    }

    /**
     * 시계와 대기 프리미티브를 주입하여 생성.
     *
     * @param config Rate Limiter 설정
     * @param ticker 단조 시계
     * @param sleeper 대기 프리미티브
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IntervalRateLimiter(RateLimiterConfig config, Ticker ticker, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.minIntervalNanos = config.minIntervalNanos();
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    @Override
    public void acquire() throws InterruptedException {
        long delayNanos = reserveSlot();
        if (delayNanos > 0) {
            log.debug("Rate limit: waiting {} ms", TimeUnit.NANOSECONDS.toMillis(delayNanos));
            sleeper.sleep(Duration.ofNanos(delayNanos));
        }
    }

    @Override
    public CompletableFuture<Void> acquireAsync() {
        long delayNanos = reserveSlot();
        if (delayNanos <= 0) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Rate limit: scheduling after {} ms", TimeUnit.NANOSECONDS.toMillis(delayNanos));
        return CompletableFuture.runAsync(
            () -> { },
            CompletableFuture.delayedExecutor(delayNanos, TimeUnit.NANOSECONDS)
        );
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * 다음 슬롯 예약.
     *
     * @return 예약된 슬롯까지 남은 시간 (나노초, 0이면 즉시 진행)
     */
    private long reserveSlot() {
        lock.lock();
        try {
            long now = ticker.read();
            long slot = now;
            if (started) {
                long nextAllowed = lastRequestNanos + minIntervalNanos;
                if (nextAllowed - now > 0) {
                    slot = nextAllowed;
                }
            }
            lastRequestNanos = slot;
            started = true;
            return slot - now;
        } finally {
            lock.unlock();
        }
    }
}
