/**
 * OkHttp 기반 Connection Context 어댑터.
 *
 * <p>{@link com.ryuqq.fetcher.adapter.okhttp.OkHttpConnectionContextFactory}가 Context마다
 * 연결 풀을 만들고, {@link com.ryuqq.fetcher.adapter.okhttp.OkHttpConnectionContext}가
 * 전송 오류를 {@link com.ryuqq.fetcher.core.spi.TransportException}으로 변환합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
package com.ryuqq.fetcher.adapter.okhttp;
