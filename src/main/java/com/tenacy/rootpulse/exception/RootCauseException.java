package com.tenacy.rootpulse.exception;

/**
 * 근본 원인 분석 과정에서 발생하는 모든 예외의 상위 타입
 */
public abstract class RootCauseException extends RuntimeException {

    protected RootCauseException(String message) {
        super(message);
    }

    protected RootCauseException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
