package com.ryuqq.fetcher.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetch 기본값 모음.
 *
 * <p>기본 헤더 세트는 헤더를 검사하는 사이트와의 호환성을 위해 값과 순서를 그대로 유지해야 합니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class FetchDefaults {

    /**
     * 기본 HTTP 요청 헤더 (일반 브라우저 흉내, 순서 보존, 읽기 전용).
     */
    public static final Map<String, String> DEFAULT_HTTP_HEADERS;

    static {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36");
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.5");
        headers.put("Connection", "keep-alive");
        headers.put("Upgrade-Insecure-Requests", "1");
        headers.put("Cache-Control", "max-age=0");
        DEFAULT_HTTP_HEADERS = Collections.unmodifiableMap(headers);
    }

    /** 요청 타임아웃 기본값: 30초. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    /** 표준 프로필 초당 요청 수. */
    public static final double DEFAULT_REQUESTS_PER_SECOND = 5.0;

    /** 고처리량 프로필 초당 요청 수. */
    public static final double HIGH_THROUGHPUT_REQUESTS_PER_SECOND = 250.0;

    /** 최대 시도 횟수 기본값. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /** 최대 누적 재시도 시간 기본값: 90초. */
    public static final Duration DEFAULT_MAX_RETRY_TIME = Duration.ofSeconds(90);

    private FetchDefaults() {
    }
}
