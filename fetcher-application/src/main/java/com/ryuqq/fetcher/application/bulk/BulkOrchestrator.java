package com.ryuqq.fetcher.application.bulk;

import com.ryuqq.fetcher.application.engine.FetchEngine;
import com.ryuqq.fetcher.core.model.FetchConfig;
import com.ryuqq.fetcher.core.outcome.FetchError;
import com.ryuqq.fetcher.core.outcome.FetchErrorKind;
import com.ryuqq.fetcher.core.outcome.FetchOutcome;
import com.ryuqq.fetcher.core.spi.ConnectionContext;
import com.ryuqq.fetcher.core.spi.FetchListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 여러 URL을 하나의 Connection Context 위에서 동시에 Fetch하는 Orchestrator.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * fetchAll(urls, config)
 *   ↓
 * 1. Connection Context 열기 (배치 전체가 공유)
 * 2. 배치 전용 스레드 풀 생성 (min(urls, maxConcurrency))
 * 3. URL마다 FetchEngine.fetch(url, config, context, listener) 제출
 * 4. 모든 작업 완료 대기 → 입력 순서대로 결과 수집
 * 5. 스레드 풀 종료, Context 닫기
 * 6. BatchPolicy 적용 (FAIL_TOGETHER이면 실패 시 BatchFetchException)
 * </pre>
 *
 * <p>개별 실패는 다른 작업을 취소하지 않습니다. 스레드 풀은 배치마다 새로 만들고 재사용하지 않습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class BulkOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BulkOrchestrator.class);

    private final FetchEngine engine;
    private final BulkConfig bulkConfig;

    /**
     * 생성자 (기본 BulkConfig 사용).
     *
     * @param engine Fetch 엔진
     * @throws IllegalArgumentException engine이 null인 경우
     */
    public BulkOrchestrator(FetchEngine engine) {
        this(engine, new BulkConfig());
    }

    /**
     * 생성자.
     *
     * @param engine Fetch 엔진 (Connection Context 팩토리 포함)
     * @param bulkConfig 배치 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BulkOrchestrator(FetchEngine engine, BulkConfig bulkConfig) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (bulkConfig == null) {
            throw new IllegalArgumentException("bulkConfig cannot be null");
        }
        this.engine = engine;
        this.bulkConfig = bulkConfig;
    }

    /**
     * 여러 URL 동시 Fetch.
     *
     * @param urls 대상 URL 목록
     * @param config 모든 Fetch에 적용할 설정 (Rate Limiter 공유)
     * @return URL마다 하나씩, 입력 순서대로의 결과
     * @throws BatchFetchException FAIL_TOGETHER 정책에서 실패가 있는 경우
     */
    public List<FetchOutcome> fetchAll(List<String> urls, FetchConfig config) {
        return fetchAll(urls, config, FetchListener.NONE);
    }

    /**
     * 여러 URL 동시 Fetch (Listener 포함).
     *
     * @param urls 대상 URL 목록
     * @param config 모든 Fetch에 적용할 설정 (Rate Limiter 공유)
     * @param listener Fetch마다 호출되는 Listener (null이면 무시)
     * @return URL마다 하나씩, 입력 순서대로의 결과
     * @throws IllegalArgumentException urls 또는 config가 null인 경우
     * @throws BatchFetchException FAIL_TOGETHER 정책에서 실패가 있는 경우
     */
    public List<FetchOutcome> fetchAll(List<String> urls, FetchConfig config, FetchListener listener) {
        requireArguments(urls, config);
        if (urls.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(urls.size(), bulkConfig.maxConcurrency());
        log.info("Fetching {} URLs with {} workers", urls.size(), workers);

        List<FetchOutcome> outcomes;
        ConnectionContext context;
        try {
            context = engine.getContextFactory().open();
        } catch (RuntimeException e) {
            log.error("Failed to open connection context for batch of {} URLs", urls.size(), e);
            return applyPolicy(failAll(urls, e));
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<CompletableFuture<FetchOutcome>> futures = new ArrayList<>(urls.size());
            for (String url : urls) {
                futures.add(
                    engine.fetchAsync(url, config, context, listener, pool)
                        .exceptionally(e -> unexpected(url, e))
                );
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<FetchOutcome> future : futures) {
                outcomes.add(future.join());
            }
        } finally {
            pool.shutdown();
            closeQuietly(context, urls.size());
        }

        return applyPolicy(outcomes);
    }

    /**
     * 여러 URL을 호출 스레드에서 하나씩 Fetch.
     *
     * @param urls 대상 URL 목록
     * @param config 모든 Fetch에 적용할 설정
     * @return 입력 순서대로의 결과
     * @throws BatchFetchException FAIL_TOGETHER 정책에서 실패가 있는 경우
     */
    public List<FetchOutcome> fetchAllSequentially(List<String> urls, FetchConfig config) {
        return fetchAllSequentially(urls, config, FetchListener.NONE);
    }

    /**
     * 여러 URL을 호출 스레드에서 하나씩 Fetch (Listener 포함).
     *
     * @param urls 대상 URL 목록
     * @param config 모든 Fetch에 적용할 설정
     * @param listener Fetch마다 호출되는 Listener (null이면 무시)
     * @return 입력 순서대로의 결과
     * @throws IllegalArgumentException urls 또는 config가 null인 경우
     * @throws BatchFetchException FAIL_TOGETHER 정책에서 실패가 있는 경우
     */
    public List<FetchOutcome> fetchAllSequentially(List<String> urls, FetchConfig config, FetchListener listener) {
        requireArguments(urls, config);
        if (urls.isEmpty()) {
            return List.of();
        }

        log.info("Fetching {} URLs sequentially", urls.size());

        ConnectionContext context;
        try {
            context = engine.getContextFactory().open();
        } catch (RuntimeException e) {
            log.error("Failed to open connection context for batch of {} URLs", urls.size(), e);
            return applyPolicy(failAll(urls, e));
        }

        List<FetchOutcome> outcomes = new ArrayList<>(urls.size());
        try {
            for (String url : urls) {
                outcomes.add(engine.fetch(url, config, context, listener));
            }
        } finally {
            closeQuietly(context, urls.size());
        }
        return applyPolicy(outcomes);
    }

    public BulkConfig getBulkConfig() {
        return bulkConfig;
    }

    private List<FetchOutcome> applyPolicy(List<FetchOutcome> outcomes) {
        List<FetchOutcome> result = Collections.unmodifiableList(outcomes);
        long failures = result.stream().filter(FetchOutcome::isFailure).count();
        log.info("Batch finished: {} succeeded, {} failed", result.size() - failures, failures);

        if (failures > 0 && bulkConfig.batchPolicy() == BatchPolicy.FAIL_TOGETHER) {
            FetchError firstError = result.stream()
                .filter(FetchOutcome::isFailure)
                .map(FetchError.class::cast)
                .findFirst()
                .orElseThrow();
            throw new BatchFetchException(firstError, result);
        }
        return result;
    }

    private static void closeQuietly(ConnectionContext context, int batchSize) {
        try {
            context.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connection context for batch of {} URLs", batchSize, e);
        }
    }

    private static List<FetchOutcome> failAll(List<String> urls, RuntimeException cause) {
        List<FetchOutcome> outcomes = new ArrayList<>(urls.size());
        for (String url : urls) {
            outcomes.add(unexpected(url, cause));
        }
        return outcomes;
    }

    private static FetchError unexpected(String url, Throwable cause) {
        return FetchError.of(FetchErrorKind.UNEXPECTED, url,
            "Unexpected error while loading " + url + ": " + cause.getMessage());
    }

    private static void requireArguments(List<String> urls, FetchConfig config) {
        if (urls == null) {
            throw new IllegalArgumentException("urls cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }
}
