package com.ryuqq.fetcher.core.spi;

/**
 * Connection Context 생성 SPI.
 *
 * <p>호출자가 Context를 전달하지 않은 단일 Fetch, 그리고 배치마다 하나의 Context를 여는
 * BulkOrchestrator가 사용합니다. 반환된 Context의 해제 책임은 호출한 쪽에 있습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionContextFactory {

    /**
     * 새 Connection Context 생성.
     *
     * @return 새 Context (호출자가 close 책임)
     */
    ConnectionContext open();
}
