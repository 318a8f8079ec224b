package com.ryuqq.fetcher.application.engine;

import com.ryuqq.fetcher.core.clock.Sleeper;
import com.ryuqq.fetcher.core.clock.Ticker;
import com.ryuqq.fetcher.core.model.FetchConfig;
import com.ryuqq.fetcher.core.outcome.FetchError;
import com.ryuqq.fetcher.core.outcome.FetchErrorKind;
import com.ryuqq.fetcher.core.outcome.FetchOutcome;
import com.ryuqq.fetcher.core.outcome.FetchResult;
import com.ryuqq.fetcher.core.retry.Retrier;
import com.ryuqq.fetcher.core.retry.RetryPolicy;
import com.ryuqq.fetcher.core.spi.ConnectionContext;
import com.ryuqq.fetcher.core.spi.ConnectionContextFactory;
import com.ryuqq.fetcher.core.spi.FetchListener;
import com.ryuqq.fetcher.core.spi.HttpRequestSpec;
import com.ryuqq.fetcher.core.spi.RawResponse;
import com.ryuqq.fetcher.core.spi.TransportException;
import com.ryuqq.fetcher.core.spi.UrlValidator;
import com.ryuqq.fetcher.core.validation.DefaultUrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 단일 URL Fetch 파이프라인.
 *
 * <p>하나의 URL에 대해 검증, Rate Limit 대기, GET 요청, 응답 분류, 재시도를 수행하고
 * 결과를 {@link FetchOutcome}으로 반환합니다. 어떤 실패도 예외로 전파하지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * fetch(url, config)
 *   ↓
 * 1. UrlValidator.isValid(url) → 실패 시 INVALID_URL (네트워크/Rate Limiter 호출 없음)
 *   ↓
 * Retrier (재시도 대상 실패이면 backoff 후 반복)
 *   2. rateLimiter.acquire()
 *   3. HttpRequestSpec 구성 (customHeaders가 비어 있으면 기본 헤더)
 *   4. ConnectionContext.get(spec)
 *   5. 분류:
 *      - 429, 503 → RATE_LIMITED
 *      - 그 외 400~599 → HTTP_STATUS_ERROR (600 이상 비표준 코드는 성공으로 취급)
 *      - Content-Type 불일치 → CONTENT_TYPE_MISMATCH
 *      - 그 외 → FetchResult
 *   ↓
 * 6. FetchListener.onSuccess / onFailure (최종 결과에 대해 한 번)
 * </pre>
 *
 * <p><strong>Connection Context 소유권:</strong></p>
 * <ul>
 *   <li>호출자가 전달한 Context는 닫지 않습니다.</li>
 *   <li>Context 없이 호출하면 Factory로 임시 Context를 열고, 모든 종료 경로에서 닫습니다.</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 엔진 자체는 불변이며 여러 스레드에서 동시에 사용할 수 있습니다.
 * 공유 상태는 {@link FetchConfig#rateLimiter()}뿐입니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class FetchEngine {

    private static final Logger log = LoggerFactory.getLogger(FetchEngine.class);

    private final ConnectionContextFactory contextFactory;
    private final UrlValidator urlValidator;
    private final Retrier retrier;
    private final Ticker ticker;

    /**
     * 생성자 (기본 검증기, 기본 재시도 정책).
     *
     * @param contextFactory Connection Context 팩토리
     * @throws IllegalArgumentException contextFactory가 null인 경우
     */
    public FetchEngine(ConnectionContextFactory contextFactory) {
        this(contextFactory, DefaultUrlValidator.lenient(), new RetryPolicy());
    }

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param contextFactory Connection Context 팩토리
     * @param urlValidator URL 검증기
     * @param retryPolicy 재시도 정책
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FetchEngine(ConnectionContextFactory contextFactory, UrlValidator urlValidator, RetryPolicy retryPolicy) {
        this(contextFactory, urlValidator, retryPolicy, Sleeper.SYSTEM, Ticker.SYSTEM);
    }

    /**
     * 생성자 (대기 프리미티브와 시계 주입).
     *
     * @param contextFactory Connection Context 팩토리
     * @param urlValidator URL 검증기
     * @param retryPolicy 재시도 정책
     * @param sleeper backoff 대기 프리미티브
     * @param ticker 경과 시간 측정용 단조 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FetchEngine(
        ConnectionContextFactory contextFactory,
        UrlValidator urlValidator,
        RetryPolicy retryPolicy,
        Sleeper sleeper,
        Ticker ticker
    ) {
        if (contextFactory == null) {
            throw new IllegalArgumentException("contextFactory cannot be null");
        }
        if (urlValidator == null) {
            throw new IllegalArgumentException("urlValidator cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.contextFactory = contextFactory;
        this.urlValidator = urlValidator;
        this.retrier = new Retrier(retryPolicy, sleeper, ticker);
        this.ticker = ticker;
    }

    /**
     * 임시 Connection Context로 Fetch.
     *
     * @param url 대상 URL
     * @param config Fetch 설정
     * @return 성공 결과 또는 분류된 실패
     */
    public FetchOutcome fetch(String url, FetchConfig config) {
        return fetch(url, config, FetchListener.NONE);
    }

    /**
     * 임시 Connection Context로 Fetch (Listener 포함).
     *
     * <p>URL이 유효하지 않으면 Context를 열지 않습니다.</p>
     *
     * @param url 대상 URL
     * @param config Fetch 설정
     * @param listener 완료 Listener (null이면 무시)
     * @return 성공 결과 또는 분류된 실패
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FetchOutcome fetch(String url, FetchConfig config, FetchListener listener) {
        requireConfig(config);
        FetchListener target = listener == null ? FetchListener.NONE : listener;

        if (!urlValidator.isValid(url)) {
            return complete(invalidUrl(url), target);
        }

        ConnectionContext context;
        try {
            context = contextFactory.open();
        } catch (RuntimeException e) {
            return complete(FetchError.of(FetchErrorKind.UNEXPECTED, url,
                "Unexpected error while loading " + url + ": " + e.getMessage()), target);
        }

        try {
            return fetch(url, config, context, target);
        } finally {
            closeQuietly(context, url);
        }
    }

    /**
     * 호출자 소유 Connection Context로 Fetch.
     *
     * <p>전달된 Context는 닫지 않습니다.</p>
     *
     * @param url 대상 URL
     * @param config Fetch 설정
     * @param context 공유 Connection Context
     * @param listener 완료 Listener (null이면 무시)
     * @return 성공 결과 또는 분류된 실패
     * @throws IllegalArgumentException config 또는 context가 null인 경우
     */
    public FetchOutcome fetch(String url, FetchConfig config, ConnectionContext context, FetchListener listener) {
        requireConfig(config);
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        FetchListener target = listener == null ? FetchListener.NONE : listener;

        if (!urlValidator.isValid(url)) {
            return complete(invalidUrl(url), target);
        }

        FetchOutcome outcome = retrier.execute(
            () -> attempt(url, config, context),
            FetchEngine::isRetryable
        );
        return complete(outcome, target);
    }

    /**
     * 주어진 Executor에서 Fetch 실행.
     *
     * <p>블로킹 경로와 같은 알고리즘을 사용합니다.</p>
     *
     * @param url 대상 URL
     * @param config Fetch 설정
     * @param context 공유 Connection Context
     * @param listener 완료 Listener (null이면 무시)
     * @param executor 실행 Executor
     * @return 결과 Future (예외로 완료되지 않음)
     * @throws IllegalArgumentException config, context, executor가 null인 경우
     */
    public CompletableFuture<FetchOutcome> fetchAsync(
        String url,
        FetchConfig config,
        ConnectionContext context,
        FetchListener listener,
        Executor executor
    ) {
        requireConfig(config);
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        return CompletableFuture.supplyAsync(() -> fetch(url, config, context, listener), executor);
    }

    /**
     * 주어진 Executor에서 임시 Connection Context로 Fetch 실행.
     *
     * @param url 대상 URL
     * @param config Fetch 설정
     * @param executor 실행 Executor
     * @return 결과 Future (예외로 완료되지 않음)
     * @throws IllegalArgumentException config 또는 executor가 null인 경우
     */
    public CompletableFuture<FetchOutcome> fetchAsync(String url, FetchConfig config, Executor executor) {
        requireConfig(config);
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        return CompletableFuture.supplyAsync(() -> fetch(url, config, FetchListener.NONE), executor);
    }

    public ConnectionContextFactory getContextFactory() {
        return contextFactory;
    }

    public RetryPolicy getRetryPolicy() {
        return retrier.getPolicy();
    }

    /**
     * 한 번의 시도 (Rate Limit 대기 → 요청 → 분류).
     */
    private FetchOutcome attempt(String url, FetchConfig config, ConnectionContext context) {
        long startNanos = ticker.read();

        try {
            config.rateLimiter().acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchError.of(FetchErrorKind.UNEXPECTED, url,
                "Interrupted while waiting for rate limiter: " + url);
        }

        RawResponse response;
        try {
            response = context.get(HttpRequestSpec.of(url, config));
        } catch (TransportException e) {
            return fromTransportFailure(url, e);
        } catch (RuntimeException e) {
            log.debug("Connection context failed unexpectedly for {}", url, e);
            return FetchError.of(FetchErrorKind.UNEXPECTED, url,
                "Unexpected error while loading " + url + ": " + e.getMessage());
        }

        return classify(url, config, response, Duration.ofNanos(ticker.read() - startNanos));
    }

    private static FetchOutcome classify(String url, FetchConfig config, RawResponse response, Duration elapsed) {
        int status = response.statusCode();
        if (status == 429 || status == 503) {
            return FetchError.of(FetchErrorKind.RATE_LIMITED, url, "Rate limit exceeded: " + status, status);
        }
        if (status >= 400 && status < 600) {
            return FetchError.of(FetchErrorKind.HTTP_STATUS_ERROR, url,
                "HTTP error for " + url + ": " + status, status);
        }

        String contentType = response.contentType();
        if (config.hasExpectedContentType() && !contentType.contains(config.expectedContentType())) {
            return FetchError.of(FetchErrorKind.CONTENT_TYPE_MISMATCH, url,
                "Expected content type '" + config.expectedContentType() + "' but got '" + contentType + "'",
                status);
        }

        return new FetchResult(url, status, response.body(), response.text(), response.headers(), elapsed, contentType);
    }

    private static FetchError fromTransportFailure(String url, TransportException e) {
        switch (e.getReason()) {
            case CONNECTION:
                return FetchError.of(FetchErrorKind.CONNECTION_FAILURE, url,
                    "Connection error for " + url + ": " + e.getMessage());
            case TIMEOUT:
                return FetchError.of(FetchErrorKind.TIMEOUT, url,
                    "Timeout error for " + url + ": " + e.getMessage());
            case TOO_MANY_REDIRECTS:
                return FetchError.of(FetchErrorKind.TOO_MANY_REDIRECTS, url,
                    "Too many redirects for " + url + ": " + e.getMessage());
            case INTERRUPTED:
                return FetchError.of(FetchErrorKind.UNEXPECTED, url,
                    "Interrupted while loading " + url + ": " + e.getMessage());
            default:
                return FetchError.of(FetchErrorKind.UNEXPECTED, url,
                    "Unexpected error while loading " + url + ": " + e.getMessage());
        }
    }

    private static void closeQuietly(ConnectionContext context, String url) {
        try {
            context.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connection context after fetching {}", url, e);
        }
    }

    private static boolean isRetryable(FetchOutcome outcome) {
        return outcome instanceof FetchError error && error.isRetryable();
    }

    private static FetchError invalidUrl(String url) {
        return FetchError.of(FetchErrorKind.INVALID_URL, url, "Invalid URL format: " + url);
    }

    /**
     * 최종 결과 로깅 및 Listener 호출.
     *
     * <p>Listener 예외는 로깅 후 무시합니다.</p>
     */
    private static FetchOutcome complete(FetchOutcome outcome, FetchListener listener) {
        if (outcome instanceof FetchResult result) {
            log.debug("Fetched {} ({}) in {} ms", result.url(), result.statusCode(), result.elapsed().toMillis());
            try {
                listener.onSuccess(result);
            } catch (RuntimeException e) {
                log.error("An exception was encountered while running the onSuccess callback for {}", result.url(), e);
            }
        } else if (outcome instanceof FetchError error) {
            log.error("Fetch failed [{}]: {}", error.kind(), error.message());
            try {
                listener.onFailure(error);
            } catch (RuntimeException e) {
                log.error("An exception was encountered while running the onFailure callback for {}", error.url(), e);
            }
        }
        return outcome;
    }

    private static void requireConfig(FetchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }
}
