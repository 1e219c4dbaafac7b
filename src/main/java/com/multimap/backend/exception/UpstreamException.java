package com.multimap.backend.exception;

/**
 * 구글 API 호출 실패 (네트워크 오류, 비정상 상태코드, 응답 형식 불일치).
 * 원인은 로그로만 남기고 클라이언트에는 일반 메시지만 내려간다.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
