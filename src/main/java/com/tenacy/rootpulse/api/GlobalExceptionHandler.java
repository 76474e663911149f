package com.tenacy.rootpulse.api;

import com.tenacy.rootpulse.api.dto.ErrorResponse;
import com.tenacy.rootpulse.exception.AnalysisValidationException;
import com.tenacy.rootpulse.exception.CollectionFailureException;
import com.tenacy.rootpulse.exception.RootCauseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AnalysisValidationException.class)
    protected ResponseEntity<ErrorResponse> handleValidation(AnalysisValidationException e) {
        log.warn("Invalid analysis request: {}", e.getMessage());
        return toResponse(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage(), false);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    protected ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable analysis request: {}", e.getMessage());
        return toResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Malformed request body", false);
    }

    /**
     * 수집 실패는 "근본 원인 없음"과 구분되도록 5xx 로 응답한다. 일시적 실패면 503.
     */
    @ExceptionHandler(CollectionFailureException.class)
    protected ResponseEntity<ErrorResponse> handleCollectionFailure(CollectionFailureException e) {
        log.error("Collection failure: window={}, failedCollectors={}, candidates={}",
                e.getWindow(), e.getFailedCollectors(), e.getCandidates(), e);
        HttpStatus status = e.isTransientFailure() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return toResponse(status, e.getCode(), e.getMessage(), e.isTransientFailure());
    }

    @ExceptionHandler(RootCauseException.class)
    protected ResponseEntity<ErrorResponse> handleRootCauseException(RootCauseException e) {
        log.error("Analysis error: {}", e.getMessage(), e);
        return toResponse(HttpStatus.BAD_GATEWAY, e.getCode(), e.getMessage(), false);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected System Failure: ", e);
        return toResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error", false);
    }

    private ResponseEntity<ErrorResponse> toResponse(HttpStatus status, String code, String message, boolean retryable) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .retryable(retryable)
                .timestamp(LocalDateTime.now())
                .build());
    }
}
