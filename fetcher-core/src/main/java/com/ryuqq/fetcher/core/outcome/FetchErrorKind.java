package com.ryuqq.fetcher.core.outcome;

/**
 * Fetch 실패 분류.
 *
 * <p>각 분류는 재시도 가능 여부를 함께 가집니다.
 * 재시도 정책은 {@link #isRetryable()}만 보고 재시도를 결정합니다.</p>
 *
 * <p><strong>일시적 실패 (재시도):</strong></p>
 * <ul>
 *   <li>CONNECTION_FAILURE: 연결 실패, 연결 리셋, DNS 실패</li>
 *   <li>TIMEOUT: 연결/읽기/쓰기/전체 호출 타임아웃</li>
 *   <li>HTTP_STATUS_ERROR: 429/503 이외의 4xx/5xx 응답</li>
 *   <li>RATE_LIMITED: 429 Too Many Requests, 503 Service Unavailable</li>
 * </ul>
 *
 * <p><strong>영구 실패 (재시도 안 함):</strong></p>
 * <ul>
 *   <li>INVALID_URL: URL 유효성 검증 실패 (네트워크 호출 없음)</li>
 *   <li>TOO_MANY_REDIRECTS: 리다이렉트 한도 초과</li>
 *   <li>CONTENT_TYPE_MISMATCH: 기대한 Content-Type이 아님</li>
 *   <li>UNEXPECTED: 분류되지 않은 모든 오류</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public enum FetchErrorKind {

    INVALID_URL(false),
    CONNECTION_FAILURE(true),
    TIMEOUT(true),
    TOO_MANY_REDIRECTS(false),
    HTTP_STATUS_ERROR(true),
    RATE_LIMITED(true),
    CONTENT_TYPE_MISMATCH(false),
    UNEXPECTED(false);

    private final boolean retryable;

    FetchErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * 재시도 가능 여부.
     *
     * @return 일시적 실패이면 true
     */
    public boolean isRetryable() {
        return retryable;
    }
}
