/**
 * Fetch outcome package.
 *
 * <p>This package defines the sealed result type returned at every component boundary of the
 * fetcher. Transport exceptions never escape the engine; they are classified into one of the
 * {@link com.ryuqq.fetcher.core.outcome.FetchErrorKind} values instead.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fetcher.core.outcome.FetchOutcome} - Sealed interface (permits FetchResult, FetchError)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fetcher.core.outcome.FetchResult} - Response received and accepted</li>
 *   <li>{@link com.ryuqq.fetcher.core.outcome.FetchError} - Classified failure (transient or permanent)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * if (outcome instanceof FetchResult result) {
 *     handle(result.text());
 * } else if (outcome instanceof FetchError error) {
 *     log.warn("{} failed: {} - {}", error.url(), error.kind(), error.message());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Fetcher Team
 */
package com.ryuqq.fetcher.core.outcome;
