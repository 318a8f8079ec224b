package com.ryuqq.fetcher.testkit.contract;

import com.ryuqq.fetcher.application.bulk.BulkConfig;
import com.ryuqq.fetcher.application.bulk.BulkOrchestrator;
import com.ryuqq.fetcher.application.engine.FetchEngine;
import com.ryuqq.fetcher.core.outcome.FetchError;
import com.ryuqq.fetcher.core.outcome.FetchErrorKind;
import com.ryuqq.fetcher.core.outcome.FetchOutcome;
import com.ryuqq.fetcher.core.outcome.FetchResult;
import com.ryuqq.fetcher.core.retry.BackoffCalculator;
import com.ryuqq.fetcher.core.retry.RetryPolicy;
import com.ryuqq.fetcher.core.validation.DefaultUrlValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for fetch Contract Tests.
 *
 * <p>This class wires a {@link FetchEngine} and a {@link BulkOrchestrator} to in-memory
 * collaborators, so scenarios run without a network.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>ScriptedHttpServer: per-URL scripted responses and transport failures</li>
 *   <li>ScriptedConnectionContextFactory: opens contexts and remembers them</li>
 *   <li>ManualClock: virtual ticker and sleeper for backoff schedules</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractFetchContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         server.respond("https://example.com", 200, "text/html", "hello");
 *
 *         FetchOutcome outcome = engine.fetch("https://example.com", FetchConfig.defaults());
 *
 *         assertSuccess(outcome, 200);
 *     }
 * }
 * </pre>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public abstract class AbstractFetchContractTest {

    protected static final int MAX_ATTEMPTS = 3;
    protected static final Duration MAX_ELAPSED = Duration.ofSeconds(90);

    protected ScriptedHttpServer server;
    protected ScriptedConnectionContextFactory contextFactory;
    protected ManualClock clock;
    protected FetchEngine engine;
    protected BulkOrchestrator orchestrator;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh collaborators and an engine retrying up to {@link #MAX_ATTEMPTS} times
     * with a jitter-free 1s, 2s, 4s backoff on the virtual clock.</p>
     */
    @BeforeEach
    void setUp() {
        server = new ScriptedHttpServer();
        contextFactory = new ScriptedConnectionContextFactory(server);
        clock = new ManualClock();
        engine = newEngine(new RetryPolicy(MAX_ATTEMPTS, MAX_ELAPSED, BackoffCalculator.withoutJitter(1000, 60000)));
        orchestrator = new BulkOrchestrator(engine, new BulkConfig());
    }

    /**
     * Cleans up test fixtures after each test.
     */
    @AfterEach
    void tearDown() {
        if (server != null) {
            server.clear();
        }
        if (contextFactory != null) {
            contextFactory.clear();
        }
        Thread.interrupted();
    }

    /**
     * Creates an engine on the shared collaborators with a custom retry policy.
     *
     * @param policy retry policy
     * @return engine using the virtual clock
     */
    protected FetchEngine newEngine(RetryPolicy policy) {
        return new FetchEngine(contextFactory, DefaultUrlValidator.lenient(), policy, clock, clock);
    }

    /**
     * Asserts that the outcome is a success with the expected status.
     *
     * @param outcome the outcome
     * @param expectedStatus expected HTTP status
     * @return the result, for further checks
     */
    protected FetchResult assertSuccess(FetchOutcome outcome, int expectedStatus) {
        assertInstanceOf(FetchResult.class, outcome,
                String.format("Expected success but got %s", outcome));
        FetchResult result = (FetchResult) outcome;
        assertEquals(expectedStatus, result.statusCode(),
                String.format("Expected status %d but was %d for url: %s",
                        expectedStatus, result.statusCode(), result.url()));
        return result;
    }

    /**
     * Asserts that the outcome is a failure of the expected kind.
     *
     * @param outcome the outcome
     * @param expectedKind expected error kind
     * @return the error, for further checks
     */
    protected FetchError assertFailure(FetchOutcome outcome, FetchErrorKind expectedKind) {
        assertInstanceOf(FetchError.class, outcome,
                String.format("Expected %s failure but got %s", expectedKind, outcome));
        FetchError error = (FetchError) outcome;
        assertEquals(expectedKind, error.kind(),
                String.format("Expected kind %s but was %s for url: %s (%s)",
                        expectedKind, error.kind(), error.url(), error.message()));
        return error;
    }

    /**
     * Asserts how many requests reached the server for the URL.
     *
     * @param url the URL
     * @param expected expected attempt count
     */
    protected void assertAttempts(String url, int expected) {
        assertEquals(expected, server.attempts(url),
                String.format("Expected %d attempts for %s but was %d", expected, url, server.attempts(url)));
    }

    /**
     * Asserts that every context opened through the factory has been closed.
     */
    protected void assertAllContextsClosed() {
        assertTrue(contextFactory.allClosed(),
                String.format("Expected all %d opened contexts to be closed", contextFactory.opened().size()));
    }
}
