package com.ryuqq.fetcher.core.spi;

/**
 * Connection Context SPI (풀링된 HTTP 세션).
 *
 * <p>여러 요청에 걸쳐 연결 수립 비용을 분산시키는 재사용 가능한 전송 세션입니다.
 * 배치 내 모든 Fetch가 하나의 인스턴스를 동시에 사용하므로 구현체는 thread-safe여야 합니다.</p>
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>호출자가 전달한 Context는 엔진이 닫지 않습니다.</li>
 *   <li>엔진이 단일 Fetch를 위해 직접 연 Context는 모든 종료 경로에서 닫힙니다.</li>
 *   <li>BulkOrchestrator가 연 Context는 배치 종료 시 닫힙니다.</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>상태 코드와 무관하게 응답을 그대로 반환 (4xx/5xx도 예외가 아님)</li>
 *   <li>전송 계층 실패는 {@link TransportException}으로 변환</li>
 *   <li>{@link HttpRequestSpec#timeout()}을 연결/읽기/쓰기 전체에 적용</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public interface ConnectionContext extends AutoCloseable {

    /**
     * GET 요청 실행.
     *
     * @param request 요청 명세
     * @return 원시 응답
     * @throws TransportException 전송 계층 실패 시
     */
    RawResponse get(HttpRequestSpec request) throws TransportException;

    /**
     * Context 해제 (연결 풀 정리).
     *
     * <p>여러 번 호출해도 안전해야 합니다.</p>
     */
    @Override
    void close();
}
