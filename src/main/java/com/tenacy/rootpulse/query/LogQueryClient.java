package com.tenacy.rootpulse.query;

import com.tenacy.rootpulse.analysis.TimeWindow;

import java.util.List;

/**
 * 로그 저장소 조회 클라이언트.
 *
 * <p>구현체는 한 번의 호출에 한 번의 조회만 수행하며 재시도하지 않는다.
 */
public interface LogQueryClient {

    /**
     * @param queryExpression 저장소 쿼리 문자열 (예: {@code statusCode:>1})
     * @param limit           최대 반환 건수
     * @throws com.tenacy.rootpulse.exception.LogQueryException   조회 실패
     * @throws com.tenacy.rootpulse.exception.CredentialException 자격 증명 획득 실패
     */
    List<LogRecord> query(String queryExpression, TimeWindow window, QueryScope scope, int limit);
}
