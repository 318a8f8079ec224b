/**
 * Fetcher Application Layer - 단일 URL Fetch 파이프라인.
 *
 * <p>URL 검증, Rate Limit 대기, GET 요청, 응답 분류, 재시도를 하나의 흐름으로 묶습니다.
 * 네트워크 I/O는 {@link com.ryuqq.fetcher.core.spi.ConnectionContext} 구현체(어댑터 모듈)에 위임합니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fetcher.application.engine.FetchEngine} - 블로킹/비동기 Fetch 진입점</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>예외 대신 값:</strong> 모든 실패는 {@link com.ryuqq.fetcher.core.outcome.FetchError}로 반환</li>
 *   <li><strong>의존성 역전:</strong> HTTP 구현체는 adapter-okhttp 모듈에 위치</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
package com.ryuqq.fetcher.application.engine;
