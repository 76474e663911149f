package com.tenacy.rootpulse.batch;

public enum CaseStatus {
    SUCCESS,
    NO_EVIDENCE,   // 분석은 성공했지만 증거가 뒷받침하는 후보가 없음
    FAILED,        // 수집 실패
    INVALID        // 입력 오류
}
