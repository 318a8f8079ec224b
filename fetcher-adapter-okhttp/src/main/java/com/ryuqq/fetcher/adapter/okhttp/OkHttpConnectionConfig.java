package com.ryuqq.fetcher.adapter.okhttp;

import java.time.Duration;

/**
 * OkHttp Connection Context 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxIdleConnections: 풀에 유지할 최대 유휴 연결 수 (기본 5)</li>
 *   <li>keepAlive: 유휴 연결 유지 시간 (기본 300초)</li>
 *   <li>retryOnConnectionFailure: OkHttp 자체 연결 재시도 여부 (기본 false, 재시도는 엔진이 담당)</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 * @param maxIdleConnections 최대 유휴 연결 수 (0 이상)
 * @param keepAlive 유휴 연결 유지 시간 (양수)
 * @param retryOnConnectionFailure OkHttp 자체 재시도 여부
 */
public record OkHttpConnectionConfig(
    int maxIdleConnections,
    Duration keepAlive,
    boolean retryOnConnectionFailure
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxIdleConnections=5, keepAlive=300s, retryOnConnectionFailure=false</p>
     */
    public OkHttpConnectionConfig() {
        this(5, Duration.ofSeconds(300), false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OkHttpConnectionConfig {
        if (maxIdleConnections < 0) {
            throw new IllegalArgumentException(
                "maxIdleConnections must be non-negative (current: " + maxIdleConnections + ")"
            );
        }
        if (keepAlive == null || keepAlive.isZero() || keepAlive.isNegative()) {
            throw new IllegalArgumentException("keepAlive must be positive (current: " + keepAlive + ")");
        }
    }

    /**
     * maxIdleConnections만 변경한 새 인스턴스 생성.
     */
    public OkHttpConnectionConfig withMaxIdleConnections(int maxIdleConnections) {
        return new OkHttpConnectionConfig(maxIdleConnections, keepAlive, retryOnConnectionFailure);
    }

    /**
     * keepAlive만 변경한 새 인스턴스 생성.
     */
    public OkHttpConnectionConfig withKeepAlive(Duration keepAlive) {
        return new OkHttpConnectionConfig(maxIdleConnections, keepAlive, retryOnConnectionFailure);
    }

    /**
     * retryOnConnectionFailure만 변경한 새 인스턴스 생성.
     */
    public OkHttpConnectionConfig withRetryOnConnectionFailure(boolean retryOnConnectionFailure) {
        return new OkHttpConnectionConfig(maxIdleConnections, keepAlive, retryOnConnectionFailure);
    }
}
