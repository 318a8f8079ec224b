package com.ryuqq.fetcher.application.bulk;

/**
 * Bulk Orchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrency: 배치당 최대 동시 Fetch 수 (기본 10)</li>
 *   <li>batchPolicy: 실패 처리 정책 (기본 COLLECT_ALL)</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 * @param maxConcurrency 최대 동시 Fetch 수 (양수)
 * @param batchPolicy 실패 처리 정책
 */
public record BulkConfig(
    int maxConcurrency,
    BatchPolicy batchPolicy
) {

    public static final int DEFAULT_MAX_CONCURRENCY = 10;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrency=10, batchPolicy=COLLECT_ALL</p>
     */
    public BulkConfig() {
        this(DEFAULT_MAX_CONCURRENCY, BatchPolicy.COLLECT_ALL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BulkConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrency must be positive (current: " + maxConcurrency + ")"
            );
        }
        if (batchPolicy == null) {
            throw new IllegalArgumentException("batchPolicy cannot be null");
        }
    }

    /**
     * maxConcurrency만 변경한 새 인스턴스 생성.
     */
    public BulkConfig withMaxConcurrency(int maxConcurrency) {
        return new BulkConfig(maxConcurrency, batchPolicy);
    }

    /**
     * batchPolicy만 변경한 새 인스턴스 생성.
     */
    public BulkConfig withBatchPolicy(BatchPolicy batchPolicy) {
        return new BulkConfig(maxConcurrency, batchPolicy);
    }
}
