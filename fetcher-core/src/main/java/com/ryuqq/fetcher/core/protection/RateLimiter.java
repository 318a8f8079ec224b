package com.ryuqq.fetcher.core.protection;

import java.util.concurrent.CompletableFuture;

/**
 * Rate Limiter SPI.
 *
 * <p>요청 간 최소 간격을 강제하여 대상 사이트로 나가는 요청 속도를 제한합니다.
 * 하나의 인스턴스를 배치 내 모든 Fetch가 공유합니다.</p>
 *
 * <p><strong>대기 방식:</strong></p>
 * <ul>
 *   <li>{@link #acquire()}: 호출 스레드를 블로킹하여 대기</li>
 *   <li>{@link #acquireAsync()}: 대기 완료 시점에 완료되는 Future 반환 (호출 스레드 비블로킹)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = new IntervalRateLimiter(RateLimiterConfig.STANDARD);
 *
 * for (String url : urls) {
 *     limiter.acquire();   // 최소 200ms 간격 보장
 *     connection.get(request(url));
 * }
 * }</pre>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 다음 요청 슬롯까지 대기 (블로킹).
     *
     * <p>마지막 요청 이후 최소 간격이 지나지 않았다면 남은 시간만큼 대기합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    void acquire() throws InterruptedException;

    /**
     * 다음 요청 슬롯까지 대기 (비블로킹).
     *
     * <p>슬롯은 호출 시점에 예약되며, 반환된 Future는 예약된 시각에 완료됩니다.</p>
     *
     * @return 대기 완료 시 완료되는 Future
     */
    CompletableFuture<Void> acquireAsync();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정 (초당 요청 수)
     */
    RateLimiterConfig getConfig();
}
