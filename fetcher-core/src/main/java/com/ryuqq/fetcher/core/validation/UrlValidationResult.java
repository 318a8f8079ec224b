package com.ryuqq.fetcher.core.validation;

/**
 * URL 검증 결과.
 *
 * @param valid 유효 여부
 * @param error 검증 실패 사유 (유효하면 null)
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public record UrlValidationResult(boolean valid, String error) {

    private static final UrlValidationResult VALID = new UrlValidationResult(true, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 실패 결과에 사유가 없는 경우
     */
    public UrlValidationResult {
        if (!valid && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank for an invalid result");
        }
    }

    public static UrlValidationResult ok() {
        return VALID;
    }

    public static UrlValidationResult invalid(String error) {
        return new UrlValidationResult(false, error);
    }
}
