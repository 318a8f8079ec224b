/**
 * Collaborator SPI package.
 *
 * <p>Extension points the fetch engine calls into but does not implement itself:</p>
 * <ul>
 *   <li>{@link com.ryuqq.fetcher.core.spi.ConnectionContext} - pooled GET primitive (see the okhttp adapter module)</li>
 *   <li>{@link com.ryuqq.fetcher.core.spi.ConnectionContextFactory} - opens contexts for ad-hoc fetches and batches</li>
 *   <li>{@link com.ryuqq.fetcher.core.spi.UrlValidator} - pure syntactic URL check</li>
 *   <li>{@link com.ryuqq.fetcher.core.spi.FetchListener} - fire-and-forget completion callbacks</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fetcher Team
 */
package com.ryuqq.fetcher.core.spi;
