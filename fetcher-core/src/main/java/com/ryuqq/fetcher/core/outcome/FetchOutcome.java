package com.ryuqq.fetcher.core.outcome;

/**
 * 단일 URL Fetch 결과.
 *
 * <p>FetchOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link FetchResult}: 응답 수신 및 분류 통과 (성공)</li>
 *   <li>{@link FetchError}: 분류된 실패 (재시도 후 최종 실패 포함)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 케이스 외의 구현을 허용하지 않습니다.
 * 컴포넌트 경계에서는 예외 대신 이 타입으로 결과를 전달합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FetchOutcome outcome = engine.fetch(url, config);
 * if (outcome instanceof FetchResult result) {
 *     store(result.content());
 * } else if (outcome instanceof FetchError error && error.kind().isRetryable()) {
 *     requeueLater(error.url());
 * }
 * }</pre>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public sealed interface FetchOutcome permits FetchResult, FetchError {

    /**
     * 요청 대상 URL.
     *
     * @return 원본 URL 문자열
     */
    String url();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof FetchResult;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof FetchError;
    }
}
