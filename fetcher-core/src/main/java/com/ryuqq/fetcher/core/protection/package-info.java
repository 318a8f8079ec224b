/**
 * Protection 패키지.
 *
 * <p>대상 사이트로 나가는 요청 속도를 제한하는 Rate Limiter SPI와 구현을 제공합니다.
 * 하나의 Rate Limiter 인스턴스는 하나의 수집 세션(배치) 동안 모든 Fetch가 공유하며,
 * 재생성 외에는 초기화되지 않습니다.</p>
 *
 * <h2>구현</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fetcher.core.protection.IntervalRateLimiter} - 최소 간격 기반 단일 슬롯 throttle</li>
 *   <li>{@link com.ryuqq.fetcher.core.protection.noop.NoOpRateLimiter} - 비제한 모드 (대기 없음)</li>
 * </ul>
 *
 * <h2>프리셋</h2>
 * <pre>{@code
 * RateLimiter polite = new IntervalRateLimiter(RateLimiterConfig.STANDARD);        // 5 rps
 * RateLimiter fast   = new IntervalRateLimiter(RateLimiterConfig.HIGH_THROUGHPUT); // 250 rps
 * }</pre>
 *
 * <h2>범위</h2>
 * <p>단일 프로세스 범위입니다. 여러 호스트 간 분산 조정은 지원하지 않습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
package com.ryuqq.fetcher.core.protection;
