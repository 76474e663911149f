package com.tenacy.rootpulse.exception;

import lombok.Getter;

/**
 * 로그 저장소 조회 실패. 일시적 실패(네트워크, 과부하)인지 영구 실패(잘못된 쿼리, 권한 거부)인지를 구분한다.
 */
@Getter
public class LogQueryException extends RootCauseException {

    private final boolean transientFailure;

    public LogQueryException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public LogQueryException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    @Override
    public String getCode() {
        return transientFailure ? "QUERY_TRANSIENT" : "QUERY_PERMANENT";
    }
}
