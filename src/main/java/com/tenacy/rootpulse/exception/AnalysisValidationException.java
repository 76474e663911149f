package com.tenacy.rootpulse.exception;

/**
 * 잘못된 시간 구간이나 후보 목록. 재시도하지 않는다.
 */
public class AnalysisValidationException extends RootCauseException {

    public AnalysisValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_REQUEST";
    }
}
