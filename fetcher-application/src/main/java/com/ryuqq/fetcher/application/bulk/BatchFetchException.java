package com.ryuqq.fetcher.application.bulk;

import com.ryuqq.fetcher.core.outcome.FetchError;
import com.ryuqq.fetcher.core.outcome.FetchOutcome;

import java.util.List;

/**
 * {@link BatchPolicy#FAIL_TOGETHER} 배치에서 실패가 있을 때 발생하는 예외.
 *
 * <p>모든 작업이 끝난 뒤에 던져지므로 전체 결과를 함께 담습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public class BatchFetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient FetchError firstError;
    private final transient List<FetchOutcome> outcomes;

    /**
     * 생성자.
     *
     * @param firstError 입력 순서상 첫 번째 실패
     * @param outcomes 입력 순서대로의 전체 결과
     */
    public BatchFetchException(FetchError firstError, List<FetchOutcome> outcomes) {
        super("Batch fetch failed: " + firstError.message());
        this.firstError = firstError;
        this.outcomes = List.copyOf(outcomes);
    }

    public FetchError getFirstError() {
        return firstError;
    }

    public List<FetchOutcome> getOutcomes() {
        return outcomes;
    }

    /**
     * 실패 건수.
     *
     * @return 결과 중 실패 개수
     */
    public long getFailureCount() {
        return outcomes.stream().filter(FetchOutcome::isFailure).count();
    }
}
