package com.tenacy.rootpulse.exception;

import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.collector.CollectorKind;
import lombok.Getter;

import java.util.List;

/**
 * 하나 이상의 수집기가 실패해 분석을 포기한 경우.
 * 케이스를 다시 실행할 수 있도록 구간, 후보, 실패한 수집기를 함께 담는다.
 */
@Getter
public class CollectionFailureException extends RootCauseException {

    private final TimeWindow window;
    private final List<String> candidates;
    private final List<CollectorKind> failedCollectors;

    public CollectionFailureException(String message, TimeWindow window, List<String> candidates,
                                      List<CollectorKind> failedCollectors, Throwable cause) {
        super(message, cause);
        this.window = window;
        this.candidates = List.copyOf(candidates);
        this.failedCollectors = List.copyOf(failedCollectors);
    }

    /**
     * 원인이 일시적 조회 실패일 때만 true. 호출자가 재시도 여부를 판단하는 데 사용한다.
     */
    public boolean isTransientFailure() {
        Throwable cause = getCause();
        return cause instanceof LogQueryException && ((LogQueryException) cause).isTransientFailure();
    }

    @Override
    public String getCode() {
        return "COLLECTION_FAILURE";
    }
}
