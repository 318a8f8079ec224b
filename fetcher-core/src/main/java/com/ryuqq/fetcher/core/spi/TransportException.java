package com.ryuqq.fetcher.core.spi;

import java.io.IOException;

/**
 * Connection Context 전송 계층 실패.
 *
 * <p>Connection Context 구현체는 라이브러리 고유 예외를 이 예외로 변환하여
 * 실패 원인({@link Reason})을 엔진에 알립니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public class TransportException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * 전송 실패 원인.
     */
    public enum Reason {
        /** 연결 수립 실패, 연결 리셋, DNS 실패 등 */
        CONNECTION,
        /** 연결/읽기/쓰기/전체 호출 타임아웃 */
        TIMEOUT,
        /** 리다이렉트 한도 초과 */
        TOO_MANY_REDIRECTS,
        /** 요청 자체를 구성할 수 없음 (잘못된 프록시 설정 등) */
        INVALID_REQUEST,
        /** 요청 중 호출 스레드가 인터럽트됨 (취소) */
        INTERRUPTED
    }

    private final Reason reason;

    public TransportException(Reason reason, String message) {
        super(message);
        this.reason = requireReason(reason);
    }

    public TransportException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = requireReason(reason);
    }

    public Reason getReason() {
        return reason;
    }

    private static Reason requireReason(Reason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        return reason;
    }
}
