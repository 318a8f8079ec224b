package com.ryuqq.fetcher.core.spi;

import com.ryuqq.fetcher.core.outcome.FetchError;
import com.ryuqq.fetcher.core.outcome.FetchResult;

import java.util.function.Consumer;

/**
 * Fetch 완료 콜백.
 *
 * <p>Fetch 하나당 최종 결과에 대해 한 번 호출됩니다 (재시도 중간 실패에는 호출되지 않음).
 * 콜백에서 발생한 예외는 엔진이 잡아서 로그로 남기며, Fetch 결과에는 영향을 주지 않습니다.</p>
 *
 * <p>배치에서는 여러 워커 스레드가 동시에 호출할 수 있으므로 구현체는 thread-safe여야 합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public interface FetchListener {

    /**
     * 아무 것도 하지 않는 Listener.
     */
    FetchListener NONE = new FetchListener() { };

    /**
     * 성공 시 호출.
     *
     * @param result 성공 결과
     */
    default void onSuccess(FetchResult result) {
    }

    /**
     * 최종 실패 시 호출.
     *
     * @param error 분류된 실패
     */
    default void onFailure(FetchError error) {
    }

    /**
     * 람다로 Listener 생성.
     *
     * @param onSuccess 성공 콜백 (null 가능)
     * @param onFailure 실패 콜백 (null 가능)
     * @return Listener
     */
    static FetchListener of(Consumer<FetchResult> onSuccess, Consumer<FetchError> onFailure) {
        return new FetchListener() {
            @Override
            public void onSuccess(FetchResult result) {
                if (onSuccess != null) {
                    onSuccess.accept(result);
                }
            }

            @Override
            public void onFailure(FetchError error) {
                if (onFailure != null) {
                    onFailure.accept(error);
                }
            }
        };
    }
}
