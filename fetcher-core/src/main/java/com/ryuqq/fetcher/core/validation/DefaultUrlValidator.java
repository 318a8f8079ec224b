package com.ryuqq.fetcher.core.validation;

import com.ryuqq.fetcher.core.spi.UrlValidator;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 기본 URL 검증기.
 *
 * <p>두 가지 모드를 제공합니다:</p>
 * <ul>
 *   <li>{@link #lenient()}: 스킴이 http/https이고 authority가 있으면 유효 (엔진 기본값)</li>
 *   <li>{@link #withRules(UrlValidationRules)}: 길이, 스킴, 호스트 종류, 도메인 형식, 쿼리 문자열을 규칙에 따라 검사</li>
 * </ul>
 *
 * <p>I/O 없이 문자열만 검사합니다. DNS 조회나 연결 확인은 하지 않습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class DefaultUrlValidator implements UrlValidator {

    // RFC 1034/1035 라벨 규칙
    private static final Pattern DOMAIN_PATTERN = Pattern.compile(
        "^(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z0-9][a-zA-Z0-9-]{0,61}[a-zA-Z0-9]$"
    );

    private static final Pattern IPV4_PATTERN = Pattern.compile(
        "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$"
    );

    private static final Pattern SCHEME_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]*");

    private static final int MAX_DOMAIN_LENGTH = 253;

    private static final DefaultUrlValidator LENIENT = new DefaultUrlValidator(null);

    private final UrlValidationRules rules;

    private DefaultUrlValidator(UrlValidationRules rules) {
        this.rules = rules;
    }

    /**
     * 느슨한 검증기 (스킴 + authority 확인).
     *
     * @return 공유 인스턴스
     */
    public static DefaultUrlValidator lenient() {
        return LENIENT;
    }

    /**
     * 엄격 규칙 검증기 ({@link UrlValidationRules#strict()}).
     *
     * @return 엄격 검증기
     */
    public static DefaultUrlValidator strict() {
        return new DefaultUrlValidator(UrlValidationRules.strict());
    }

    /**
     * 규칙 기반 검증기.
     *
     * @param rules 검증 규칙
     * @return 검증기
     * @throws IllegalArgumentException rules가 null인 경우
     */
    public static DefaultUrlValidator withRules(UrlValidationRules rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        return new DefaultUrlValidator(rules);
    }

    @Override
    public boolean isValid(String url) {
        return validate(url).valid();
    }

    /**
     * URL 검증 (실패 사유 포함).
     *
     * @param url 검사할 URL
     * @return 검증 결과
     */
    public UrlValidationResult validate(String url) {
        if (url == null || url.isBlank()) {
            return UrlValidationResult.invalid("URL must be a non-empty string");
        }
        if (rules == null) {
            return validateLenient(url);
        }
        return validateWithRules(url, rules);
    }

    /**
     * 스킴과 authority만 분리하여 검사합니다.
     *
     * <p>경로와 쿼리는 해석하지 않으므로 인코딩되지 않은 공백, {@code |}, {@code {}} 등이 있어도
     * 유효합니다. 인코딩은 전송 계층이 처리합니다.</p>
     */
    private UrlValidationResult validateLenient(String url) {
        String trimmed = url.strip();
        int colon = trimmed.indexOf(':');
        String scheme = colon > 0 ? trimmed.substring(0, colon) : null;
        if (scheme == null
            || !SCHEME_PATTERN.matcher(scheme).matches()
            || !UrlValidationRules.HTTP_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            return UrlValidationResult.invalid("URL scheme must be http or https");
        }

        String rest = trimmed.substring(colon + 1);
        if (!rest.startsWith("//")) {
            return UrlValidationResult.invalid("URL must include a domain/host");
        }
        int end = rest.length();
        for (int i = 2; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                end = i;
                break;
            }
        }
        if (end == 2) {
            return UrlValidationResult.invalid("URL must include a domain/host");
        }
        return UrlValidationResult.ok();
    }

    private UrlValidationResult validateWithRules(String url, UrlValidationRules rules) {
        if (url.length() < rules.minLength()) {
            return UrlValidationResult.invalid("URL is too short (minimum " + rules.minLength() + " characters)");
        }
        if (url.length() > rules.maxLength()) {
            return UrlValidationResult.invalid("URL is too long (maximum " + rules.maxLength() + " characters)");
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return UrlValidationResult.invalid("Invalid URL format: " + e.getMessage());
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            return UrlValidationResult.invalid("URL must include a scheme (e.g., 'http://', 'https://')");
        }
        if (!rules.allowedSchemes().isEmpty()
            && !rules.allowedSchemes().contains(scheme.toLowerCase(Locale.ROOT))) {
            return UrlValidationResult.invalid(
                "URL scheme '" + scheme + "' is not allowed. Allowed schemes: "
                    + String.join(", ", rules.allowedSchemes().stream().sorted().toList()));
        }

        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            return UrlValidationResult.invalid("URL must include a domain/host");
        }

        // URI는 '_' 등이 포함된 호스트를 registry 기반 authority로 취급하여 host를 null로 둔다
        String host = uri.getHost();
        boolean ipv6 = host != null && host.startsWith("[");
        boolean ipv4 = host != null && IPV4_PATTERN.matcher(host).matches();

        if (ipv4 && !rules.allowIp()) {
            return UrlValidationResult.invalid("IP addresses are not allowed as hosts");
        }
        if (ipv6 && !rules.allowIpv6()) {
            return UrlValidationResult.invalid("IPv6 addresses are not allowed as hosts");
        }

        if (!ipv4 && !ipv6) {
            if (rules.requireTld() && (!authority.contains(".") || authority.endsWith("."))) {
                return UrlValidationResult.invalid("URL must have a valid top-level domain");
            }
            if (!isValidDomain(host)) {
                return UrlValidationResult.invalid("URL contains an invalid domain name");
            }
        }

        if (rules.requireQuery() && (uri.getRawQuery() == null || uri.getRawQuery().isEmpty())) {
            return UrlValidationResult.invalid("URL must include a query string");
        }

        return UrlValidationResult.ok();
    }

    private static boolean isValidDomain(String host) {
        if (host == null || host.isEmpty() || host.length() > MAX_DOMAIN_LENGTH) {
            return false;
        }
        // 단일 라벨 호스트 (예: localhost)는 TLD 규칙이 없을 때 허용
        if (!host.contains(".")) {
            return host.matches("[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?");
        }
        return DOMAIN_PATTERN.matcher(host).matches();
    }
}
