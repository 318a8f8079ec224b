package com.ryuqq.fetcher.core.outcome;

/**
 * 분류된 Fetch 실패.
 *
 * <p>네트워크 계층의 원시 예외는 FetchEngine 경계를 넘지 않으며,
 * 모두 이 record로 분류되어 호출자에게 전달됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>INVALID_URL: "Invalid URL format: not-a-url"</li>
 *   <li>RATE_LIMITED: "Rate limit exceeded: 429" (statusCode=429)</li>
 *   <li>CONTENT_TYPE_MISMATCH: "Expected content type 'text/html' but got 'application/json'"</li>
 * </ul>
 *
 * @param kind 실패 분류
 * @param url 요청 대상 URL (유효성 검증 실패 시 원본 문자열 그대로)
 * @param message 사람이 읽을 수 있는 오류 메시지
 * @param statusCode HTTP 상태 코드 (선택, null 가능)
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public record FetchError(
    FetchErrorKind kind,
    String url,
    String message,
    Integer statusCode
) implements FetchOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public FetchError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // url은 유효성 검증 실패 케이스에서 null일 수 있음
    }

    /**
     * 상태 코드 없이 FetchError 생성.
     *
     * @param kind 실패 분류
     * @param url 요청 대상 URL
     * @param message 오류 메시지
     * @return FetchError 인스턴스
     */
    public static FetchError of(FetchErrorKind kind, String url, String message) {
        return new FetchError(kind, url, message, null);
    }

    /**
     * 상태 코드를 포함한 FetchError 생성.
     *
     * @param kind 실패 분류
     * @param url 요청 대상 URL
     * @param message 오류 메시지
     * @param statusCode HTTP 상태 코드
     * @return FetchError 인스턴스
     */
    public static FetchError of(FetchErrorKind kind, String url, String message, int statusCode) {
        return new FetchError(kind, url, message, statusCode);
    }

    /**
     * 재시도 가능한 실패인지 확인.
     *
     * @return {@link FetchErrorKind#isRetryable()} 결과
     */
    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * 상태 코드 존재 여부.
     *
     * @return statusCode가 있으면 true
     */
    public boolean hasStatusCode() {
        return statusCode != null;
    }
}
