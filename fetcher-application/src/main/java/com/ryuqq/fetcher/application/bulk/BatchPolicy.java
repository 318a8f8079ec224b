package com.ryuqq.fetcher.application.bulk;

/**
 * 배치 실패 처리 정책.
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public enum BatchPolicy {

    /**
     * 모든 결과를 입력 순서대로 반환 (기본값).
     */
    COLLECT_ALL,

    /**
     * 모든 작업이 끝난 뒤 실패가 하나라도 있으면 {@link BatchFetchException}을 던짐.
     *
     * <p>실패가 나머지 작업을 취소하지는 않습니다.</p>
     */
    FAIL_TOGETHER
}
