package com.ryuqq.fetcher.core.outcome;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 성공한 Fetch 결과.
 *
 * <p>전송 계층 응답 본문(raw bytes)과 디코딩된 텍스트, 응답 헤더를 그대로 담습니다.
 * HTML 파싱이나 JS 렌더링은 수행하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong></p>
 * <ul>
 *   <li>content는 생성 시와 조회 시 모두 복사됩니다.</li>
 *   <li>headers는 대소문자를 구분하지 않는 읽기 전용 Map입니다.</li>
 *   <li>content와 text는 같은 응답 본문을 가리킵니다 (text는 응답 charset, 기본 UTF-8로 디코딩).</li>
 * </ul>
 *
 * @param url 요청 대상 URL
 * @param statusCode HTTP 상태 코드
 * @param content 응답 본문 원본 바이트
 * @param text 디코딩된 응답 본문
 * @param headers 응답 헤더 (키 대소문자 무시)
 * @param elapsed 시도 시작부터 응답 분류까지 걸린 시간
 * @param contentType Content-Type 헤더 값 (없으면 빈 문자열)
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public record FetchResult(
    String url,
    int statusCode,
    byte[] content,
    String text,
    Map<String, String> headers,
    Duration elapsed,
    String contentType
) implements FetchOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException url이 null이거나 statusCode가 유효 범위가 아닌 경우
     */
    public FetchResult {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("statusCode must be a three-digit code between 100 and 999 (current: " + statusCode + ")");
        }
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed cannot be null or negative");
        }
        content = content == null ? new byte[0] : content.clone();
        text = text == null ? "" : text;
        contentType = contentType == null ? "" : contentType;
        headers = caseInsensitiveCopy(headers);
    }

    /**
     * 응답 본문 원본 바이트 (복사본).
     *
     * @return 본문 바이트 배열
     */
    @Override
    public byte[] content() {
        return content.clone();
    }

    /**
     * 성공 여부. 이 variant는 항상 true 입니다.
     *
     * @return true
     */
    public boolean success() {
        return true;
    }

    /**
     * 헤더 값 조회 (대소문자 무시).
     *
     * @param name 헤더 이름
     * @return 헤더 값, 없으면 null
     */
    public String header(String name) {
        return headers.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FetchResult other)) {
            return false;
        }
        return statusCode == other.statusCode
            && url.equals(other.url)
            && Arrays.equals(content, other.content)
            && text.equals(other.text)
            && headers.equals(other.headers)
            && elapsed.equals(other.elapsed)
            && contentType.equals(other.contentType);
    }

    @Override
    public int hashCode() {
        int result = url.hashCode();
        result = 31 * result + statusCode;
        result = 31 * result + Arrays.hashCode(content);
        result = 31 * result + contentType.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "FetchResult{url=" + url
            + ", statusCode=" + statusCode
            + ", contentLength=" + content.length
            + ", contentType=" + contentType
            + ", elapsed=" + elapsed.toMillis() + "ms}";
    }

    private static Map<String, String> caseInsensitiveCopy(Map<String, String> source) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}
