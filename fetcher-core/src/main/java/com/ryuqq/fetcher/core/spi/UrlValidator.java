package com.ryuqq.fetcher.core.spi;

/**
 * URL 유효성 검증 SPI.
 *
 * <p>순수 함수여야 합니다 (I/O 없음, 부수 효과 없음).
 * 검증에 실패한 URL은 네트워크에 도달하지 않습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UrlValidator {

    /**
     * URL 유효성 확인.
     *
     * @param url 검사할 URL (null 가능)
     * @return 유효하면 true
     */
    boolean isValid(String url);
}
