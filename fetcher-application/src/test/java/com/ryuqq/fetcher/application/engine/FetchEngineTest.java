package com.ryuqq.fetcher.application.engine;

import com.ryuqq.fetcher.core.clock.Sleeper;
import com.ryuqq.fetcher.core.clock.Ticker;
import com.ryuqq.fetcher.core.model.FetchConfig;
import com.ryuqq.fetcher.core.model.FetchDefaults;
import com.ryuqq.fetcher.core.outcome.FetchError;
import com.ryuqq.fetcher.core.outcome.FetchErrorKind;
import com.ryuqq.fetcher.core.outcome.FetchOutcome;
import com.ryuqq.fetcher.core.outcome.FetchResult;
import com.ryuqq.fetcher.core.protection.RateLimiter;
import com.ryuqq.fetcher.core.retry.BackoffCalculator;
import com.ryuqq.fetcher.core.retry.RetryPolicy;
import com.ryuqq.fetcher.core.spi.ConnectionContext;
import com.ryuqq.fetcher.core.spi.ConnectionContextFactory;
import com.ryuqq.fetcher.core.spi.FetchListener;
import com.ryuqq.fetcher.core.spi.HttpRequestSpec;
import com.ryuqq.fetcher.core.spi.RawResponse;
import com.ryuqq.fetcher.core.spi.TransportException;
import com.ryuqq.fetcher.core.validation.DefaultUrlValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * FetchEngine 유닛 테스트.
 *
 * <p>Connection Context와 Rate Limiter는 Mock으로, 시계는 가상 시계로 대체합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FetchEngineTest {

    private static final String URL = "https://example.com/page";

    @Mock
    private ConnectionContextFactory contextFactory;

    @Mock
    private ConnectionContext context;

    @Mock
    private FetchListener listener;

    private AtomicLong now;
    private List<Duration> sleeps;
    private FetchEngine engine;

    @BeforeEach
    void setUp() {
        now = new AtomicLong();
        sleeps = new ArrayList<>();
        Ticker ticker = now::get;
        Sleeper sleeper = duration -> {
            sleeps.add(duration);
            now.addAndGet(duration.toNanos());
        };
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(90), BackoffCalculator.withoutJitter(1000, 60000));
        engine = new FetchEngine(contextFactory, DefaultUrlValidator.lenient(), policy, sleeper, ticker);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static RawResponse html(int status, String body) {
        return new RawResponse(status, Map.of("Content-Type", "text/html; charset=utf-8"),
            body.getBytes(StandardCharsets.UTF_8), body);
    }

    // ============================================================
    // 1. URL 검증 게이트
    // ============================================================

    @Test
    void fetch_유효하지_않은_URL은_네트워크와_RateLimiter를_건드리지_않는다() throws Exception {
        // given
        RateLimiter rateLimiter = mock(RateLimiter.class);
        FetchConfig config = FetchConfig.defaults().withRateLimiter(rateLimiter);

        // when
        FetchOutcome outcome = engine.fetch("not a url", config, listener);

        // then
        assertThat(outcome).isInstanceOf(FetchError.class);
        FetchError error = (FetchError) outcome;
        assertThat(error.kind()).isEqualTo(FetchErrorKind.INVALID_URL);
        assertThat(error.message()).isEqualTo("Invalid URL format: not a url");

        verifyNoInteractions(contextFactory, rateLimiter);
        verify(listener).onFailure(error);
        verify(listener, never()).onSuccess(any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fetch_null_URL도_INVALID_URL로_분류된다() {
        FetchOutcome outcome = engine.fetch(null, FetchConfig.defaults(), context, FetchListener.NONE);

        assertThat(((FetchError) outcome).kind()).isEqualTo(FetchErrorKind.INVALID_URL);
        verifyNoInteractions(context);
    }

    // ============================================================
    // 2. 성공 경로
    // ============================================================

    @Test
    void fetch_200_응답은_FetchResult로_반환된다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(200, "<html>ok</html>"));

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults(), context, listener);

        // then
        assertThat(outcome).isInstanceOf(FetchResult.class);
        FetchResult result = (FetchResult) outcome;
        assertThat(result.url()).isEqualTo(URL);
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.text()).isEqualTo("<html>ok</html>");
        assertThat(result.content()).isEqualTo("<html>ok</html>".getBytes(StandardCharsets.UTF_8));
        assertThat(result.contentType()).isEqualTo("text/html; charset=utf-8");
        assertThat(result.header("content-type")).isEqualTo("text/html; charset=utf-8");

        verify(listener).onSuccess(result);
        verify(listener, never()).onFailure(any());
        verify(context, never()).close();
    }

    @Test
    void fetch_경과시간은_RateLimiter_대기를_포함한다() throws Exception {
        // given
        RateLimiter rateLimiter = mock(RateLimiter.class);
        doAnswer(invocation -> {
            now.addAndGet(Duration.ofMillis(300).toNanos());
            return null;
        }).when(rateLimiter).acquire();
        when(context.get(any())).thenAnswer(invocation -> {
            now.addAndGet(Duration.ofMillis(50).toNanos());
            return html(200, "ok");
        });

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults().withRateLimiter(rateLimiter), context, null);

        // then
        assertThat(((FetchResult) outcome).elapsed()).isEqualTo(Duration.ofMillis(350));
        verify(rateLimiter).acquire();
    }

    @Test
    void fetch_커스텀_헤더가_없으면_기본_헤더로_요청한다() throws Exception {
        // given
        ArgumentCaptor<HttpRequestSpec> captor = ArgumentCaptor.forClass(HttpRequestSpec.class);
        when(context.get(captor.capture())).thenReturn(html(200, "ok"));
        FetchConfig config = FetchConfig.defaults()
            .withQueryParams(Map.of("q", "java"))
            .withTimeout(Duration.ofSeconds(7));

        // when
        engine.fetch(URL, config, context, null);

        // then
        HttpRequestSpec spec = captor.getValue();
        assertThat(spec.url()).isEqualTo(URL);
        assertThat(spec.headers()).isEqualTo(FetchDefaults.DEFAULT_HTTP_HEADERS);
        assertThat(spec.queryParams()).containsEntry("q", "java");
        assertThat(spec.timeout()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void fetch_기대_Content_Type이_부분_문자열로_포함되면_성공() throws Exception {
        when(context.get(any())).thenReturn(html(200, "ok"));

        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults().withExpectedContentType("text/html"),
            context, null);

        assertThat(outcome.isSuccess()).isTrue();
    }

    // ============================================================
    // 3. 분류 및 재시도
    // ============================================================

    @Test
    void fetch_429는_RATE_LIMITED로_최대_시도까지_재시도한다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(429, "slow down"));

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults(), context, listener);

        // then
        FetchError error = (FetchError) outcome;
        assertThat(error.kind()).isEqualTo(FetchErrorKind.RATE_LIMITED);
        assertThat(error.statusCode()).isEqualTo(429);
        assertThat(error.message()).isEqualTo("Rate limit exceeded: 429");
        verify(context, times(3)).get(any());
        assertThat(sleeps).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000));
        verify(listener, times(1)).onFailure(error);
    }

    @Test
    void fetch_503도_RATE_LIMITED로_분류된다() throws Exception {
        when(context.get(any())).thenReturn(html(503, "unavailable"));

        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        assertThat(error.kind()).isEqualTo(FetchErrorKind.RATE_LIMITED);
        assertThat(error.statusCode()).isEqualTo(503);
    }

    @Test
    void fetch_404는_HTTP_STATUS_ERROR로_재시도된다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(404, "missing"));

        // when
        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        // then
        assertThat(error.kind()).isEqualTo(FetchErrorKind.HTTP_STATUS_ERROR);
        assertThat(error.statusCode()).isEqualTo(404);
        verify(context, times(3)).get(any());
    }

    @Test
    void fetch_600_이상의_비표준_상태는_오류로_분류하지_않는다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(999, "nonstandard"));

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults(), context, null);

        // then
        assertThat(outcome).isInstanceOf(FetchResult.class);
        assertThat(((FetchResult) outcome).statusCode()).isEqualTo(999);
        verify(context, times(1)).get(any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fetch_599는_HTTP_STATUS_ERROR로_분류된다() throws Exception {
        when(context.get(any())).thenReturn(html(599, "edge"));

        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        assertThat(error.kind()).isEqualTo(FetchErrorKind.HTTP_STATUS_ERROR);
        assertThat(error.statusCode()).isEqualTo(599);
    }

    @Test
    void fetch_일시_실패_후_성공하면_성공_결과를_반환한다() throws Exception {
        // given
        when(context.get(any()))
            .thenThrow(new TransportException(TransportException.Reason.CONNECTION, "Connection refused"))
            .thenReturn(html(200, "recovered"));

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults(), context, listener);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        verify(context, times(2)).get(any());
        verify(listener, never()).onFailure(any());
        verify(listener).onSuccess(any());
    }

    @Test
    void fetch_타임아웃은_TIMEOUT으로_재시도된다() throws Exception {
        when(context.get(any()))
            .thenThrow(new TransportException(TransportException.Reason.TIMEOUT, "timeout"));

        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        assertThat(error.kind()).isEqualTo(FetchErrorKind.TIMEOUT);
        assertThat(error.message()).isEqualTo("Timeout error for " + URL + ": timeout");
        verify(context, times(3)).get(any());
    }

    @Test
    void fetch_Content_Type_불일치는_재시도하지_않는다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(200, "<html/>"));
        FetchConfig config = FetchConfig.defaults().withExpectedContentType("application/json");

        // when
        FetchError error = (FetchError) engine.fetch(URL, config, context, null);

        // then
        assertThat(error.kind()).isEqualTo(FetchErrorKind.CONTENT_TYPE_MISMATCH);
        assertThat(error.message())
            .isEqualTo("Expected content type 'application/json' but got 'text/html; charset=utf-8'");
        verify(context, times(1)).get(any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fetch_리다이렉트_초과는_재시도하지_않는다() throws Exception {
        when(context.get(any()))
            .thenThrow(new TransportException(TransportException.Reason.TOO_MANY_REDIRECTS, "Too many follow-up requests: 21"));

        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        assertThat(error.kind()).isEqualTo(FetchErrorKind.TOO_MANY_REDIRECTS);
        verify(context, times(1)).get(any());
    }

    @Test
    void fetch_잘못된_요청과_런타임_예외는_UNEXPECTED로_재시도하지_않는다() throws Exception {
        // given
        when(context.get(any()))
            .thenThrow(new TransportException(TransportException.Reason.INVALID_REQUEST, "bad proxy"))
            .thenThrow(new IllegalStateException("boom"));

        // when
        FetchError first = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);
        FetchError second = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        // then
        assertThat(first.kind()).isEqualTo(FetchErrorKind.UNEXPECTED);
        assertThat(second.kind()).isEqualTo(FetchErrorKind.UNEXPECTED);
        assertThat(second.message()).isEqualTo("Unexpected error while loading " + URL + ": boom");
        verify(context, times(2)).get(any());
    }

    @Test
    void fetch_전송_중_인터럽트는_UNEXPECTED로_재시도하지_않는다() throws Exception {
        // given
        when(context.get(any()))
            .thenThrow(new TransportException(TransportException.Reason.INTERRUPTED, "interrupted"));

        // when
        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), context, null);

        // then
        assertThat(error.kind()).isEqualTo(FetchErrorKind.UNEXPECTED);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error.message()).isEqualTo("Interrupted while loading " + URL + ": interrupted");
        verify(context, times(1)).get(any());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fetch_RateLimiter_대기중_인터럽트는_UNEXPECTED로_끝나고_플래그를_복원한다() throws Exception {
        // given
        RateLimiter rateLimiter = mock(RateLimiter.class);
        doThrow(new InterruptedException("stop")).when(rateLimiter).acquire();

        // when
        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults().withRateLimiter(rateLimiter),
            context, null);

        // then
        assertThat(error.kind()).isEqualTo(FetchErrorKind.UNEXPECTED);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verifyNoInteractions(context);
    }

    // ============================================================
    // 4. Listener 및 Context 소유권
    // ============================================================

    @Test
    void fetch_Listener_예외는_전파되지_않는다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(200, "ok"));
        FetchListener throwing = FetchListener.of(
            result -> { throw new IllegalStateException("listener bug"); },
            error -> { throw new IllegalStateException("listener bug"); }
        );

        // when
        FetchOutcome success = engine.fetch(URL, FetchConfig.defaults(), context, throwing);
        FetchOutcome failure = engine.fetch("ftp://nope", FetchConfig.defaults(), context, throwing);

        // then
        assertThat(success.isSuccess()).isTrue();
        assertThat(failure.isFailure()).isTrue();
    }

    @Test
    void fetch_임시_Context는_성공_후_닫힌다() throws Exception {
        // given
        when(contextFactory.open()).thenReturn(context);
        when(context.get(any())).thenReturn(html(200, "ok"));

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults());

        // then
        assertThat(outcome.isSuccess()).isTrue();
        verify(contextFactory).open();
        verify(context).close();
    }

    @Test
    void fetch_임시_Context는_실패_후에도_닫힌다() throws Exception {
        // given
        when(contextFactory.open()).thenReturn(context);
        when(context.get(any())).thenThrow(new IllegalStateException("boom"));

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults());

        // then
        assertThat(outcome.isFailure()).isTrue();
        verify(context).close();
    }

    @Test
    void fetch_임시_Context_닫기_실패는_결과를_잃지_않는다() throws Exception {
        // given
        when(contextFactory.open()).thenReturn(context);
        when(context.get(any())).thenReturn(html(200, "ok"));
        doThrow(new IllegalStateException("pool teardown failed")).when(context).close();

        // when
        FetchOutcome outcome = engine.fetch(URL, FetchConfig.defaults(), listener);

        // then
        assertThat(outcome).isInstanceOf(FetchResult.class);
        assertThat(((FetchResult) outcome).text()).isEqualTo("ok");
        verify(listener).onSuccess((FetchResult) outcome);
        verify(context).close();
    }

    @Test
    void fetch_Context_열기_실패는_UNEXPECTED로_반환된다() {
        when(contextFactory.open()).thenThrow(new IllegalStateException("pool closed"));

        FetchError error = (FetchError) engine.fetch(URL, FetchConfig.defaults(), listener);

        assertThat(error.kind()).isEqualTo(FetchErrorKind.UNEXPECTED);
        verify(listener).onFailure(error);
    }

    // ============================================================
    // 5. 비동기 및 입력 검증
    // ============================================================

    @Test
    void fetchAsync_주어진_Executor에서_같은_알고리즘을_실행한다() throws Exception {
        // given
        when(context.get(any())).thenReturn(html(200, "async"));
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            // when
            FetchOutcome outcome = engine.fetchAsync(URL, FetchConfig.defaults(), context, listener, executor)
                .get(5, TimeUnit.SECONDS);

            // then
            assertThat(((FetchResult) outcome).text()).isEqualTo("async");
            verify(listener).onSuccess(any());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void 필수_인자가_null이면_예외() {
        assertThatThrownBy(() -> new FetchEngine(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("contextFactory cannot be null");
        assertThatThrownBy(() -> engine.fetch(URL, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> engine.fetch(URL, FetchConfig.defaults(), null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("context cannot be null");
        assertThatThrownBy(() -> engine.fetchAsync(URL, FetchConfig.defaults(), context, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("executor cannot be null");
    }
}
