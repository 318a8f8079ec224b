package com.ryuqq.fetcher.core.protection.noop;

import com.ryuqq.fetcher.core.protection.RateLimiter;
import com.ryuqq.fetcher.core.protection.RateLimiterConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>대기 없이 모든 요청을 즉시 통과시킵니다.
 * FetchConfig에 Rate Limiter가 지정되지 않은 경우(비제한 모드)에 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 즉시 반환</li>
 *   <li>acquireAsync(): 이미 완료된 Future 반환</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * <p>상태가 없으므로 하나의 인스턴스({@link #INSTANCE})를 공유해도 안전합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    public static final NoOpRateLimiter INSTANCE = new NoOpRateLimiter();

    private static final RateLimiterConfig UNLIMITED_CONFIG =
        new RateLimiterConfig(Double.MAX_VALUE);

    @Override
    public void acquire() {
        // no-op
    }

    @Override
    public CompletableFuture<Void> acquireAsync() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
