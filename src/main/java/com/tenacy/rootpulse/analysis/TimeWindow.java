package com.tenacy.rootpulse.analysis;

import com.tenacy.rootpulse.exception.AnalysisValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * 분석 대상 조회 구간. start 는 항상 end 보다 앞선다.
 */
@Getter
@EqualsAndHashCode
public final class TimeWindow {

    public static final DateTimeFormatter INPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RANGE_SEPARATOR = "~";

    private final LocalDateTime start;
    private final LocalDateTime end;

    private TimeWindow(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    public static TimeWindow of(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new AnalysisValidationException("Time window requires both start and end");
        }
        if (!start.isBefore(end)) {
            throw new AnalysisValidationException(
                    String.format("Time window start must be before end: %s ~ %s", start, end));
        }
        return new TimeWindow(start, end);
    }

    /**
     * "yyyy-MM-dd HH:mm:ss ~ yyyy-MM-dd HH:mm:ss" 형식의 구간 문자열 파싱
     */
    public static TimeWindow parse(String range) {
        if (range == null || !range.contains(RANGE_SEPARATOR)) {
            throw new AnalysisValidationException("Invalid time range format: " + range);
        }

        int separator = range.indexOf(RANGE_SEPARATOR);
        String startText = range.substring(0, separator).trim();
        String endText = range.substring(separator + 1).trim();

        try {
            return of(LocalDateTime.parse(startText, INPUT_FORMAT), LocalDateTime.parse(endText, INPUT_FORMAT));
        } catch (DateTimeParseException e) {
            throw new AnalysisValidationException("Invalid time format in: " + range);
        }
    }

    @Override
    public String toString() {
        return start.format(INPUT_FORMAT) + " ~ " + end.format(INPUT_FORMAT);
    }
}
