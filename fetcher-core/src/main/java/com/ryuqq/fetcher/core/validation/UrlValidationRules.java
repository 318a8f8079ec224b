package com.ryuqq.fetcher.core.validation;

import java.util.Set;

/**
 * URL 검증 규칙 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>allowedSchemes: 허용 스킴 (비어 있으면 모든 스킴 허용, 기본 http/https)</li>
 *   <li>requireTld: 최상위 도메인 필수 여부 (기본 true, localhost 등 단일 라벨 호스트는 false로 허용)</li>
 *   <li>requireQuery: 쿼리 문자열 필수 여부 (기본 false)</li>
 *   <li>allowIp: IPv4 호스트 허용 여부 (기본 true)</li>
 *   <li>allowIpv6: IPv6 호스트 허용 여부 (기본 true)</li>
 *   <li>minLength: 최소 길이 (기본 3)</li>
 *   <li>maxLength: 최대 길이 (기본 2083)</li>
 * </ul>
 *
 * @author Fetcher Team
 * @since 1.0.0
 * @param allowedSchemes 허용 스킴
 * @param requireTld 최상위 도메인 필수 여부
 * @param requireQuery 쿼리 문자열 필수 여부
 * @param allowIp IPv4 호스트 허용 여부
 * @param allowIpv6 IPv6 호스트 허용 여부
 * @param minLength 최소 길이 (0 이상)
 * @param maxLength 최대 길이 (minLength 이상)
 */
public record UrlValidationRules(
    Set<String> allowedSchemes,
    boolean requireTld,
    boolean requireQuery,
    boolean allowIp,
    boolean allowIpv6,
    int minLength,
    int maxLength
) {

    public static final Set<String> HTTP_SCHEMES = Set.of("http", "https");

    /**
     * 기본 규칙 생성자.
     *
     * <p>기본값: allowedSchemes=[http, https], requireTld=true, requireQuery=false,
     * allowIp=true, allowIpv6=true, minLength=3, maxLength=2083</p>
     */
    public UrlValidationRules() {
        this(HTTP_SCHEMES, true, false, true, true, 3, 2083);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 길이 범위가 잘못된 경우
     */
    public UrlValidationRules {
        allowedSchemes = allowedSchemes == null ? Set.of() : Set.copyOf(allowedSchemes);
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be non-negative (current: " + minLength + ")");
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException(
                "maxLength must be >= minLength (min: " + minLength + ", max: " + maxLength + ")"
            );
        }
    }

    /**
     * 엄격 규칙: 최상위 도메인 필수, IP 호스트 금지.
     *
     * @return 엄격 규칙
     */
    public static UrlValidationRules strict() {
        return new UrlValidationRules(HTTP_SCHEMES, true, false, false, false, 3, 2083);
    }

    /**
     * allowedSchemes만 변경한 새 인스턴스 생성.
     */
    public UrlValidationRules withAllowedSchemes(Set<String> allowedSchemes) {
        return new UrlValidationRules(allowedSchemes, requireTld, requireQuery, allowIp, allowIpv6, minLength, maxLength);
    }

    /**
     * requireTld만 변경한 새 인스턴스 생성.
     */
    public UrlValidationRules withRequireTld(boolean requireTld) {
        return new UrlValidationRules(allowedSchemes, requireTld, requireQuery, allowIp, allowIpv6, minLength, maxLength);
    }

    /**
     * requireQuery만 변경한 새 인스턴스 생성.
     */
    public UrlValidationRules withRequireQuery(boolean requireQuery) {
        return new UrlValidationRules(allowedSchemes, requireTld, requireQuery, allowIp, allowIpv6, minLength, maxLength);
    }

    /**
     * allowIp만 변경한 새 인스턴스 생성.
     */
    public UrlValidationRules withAllowIp(boolean allowIp) {
        return new UrlValidationRules(allowedSchemes, requireTld, requireQuery, allowIp, allowIpv6, minLength, maxLength);
    }

    /**
     * allowIpv6만 변경한 새 인스턴스 생성.
     */
    public UrlValidationRules withAllowIpv6(boolean allowIpv6) {
        return new UrlValidationRules(allowedSchemes, requireTld, requireQuery, allowIp, allowIpv6, minLength, maxLength);
    }
}
