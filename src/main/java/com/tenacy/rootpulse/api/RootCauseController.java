package com.tenacy.rootpulse.api;

import com.tenacy.rootpulse.analysis.AlarmType;
import com.tenacy.rootpulse.analysis.AnalysisResult;
import com.tenacy.rootpulse.analysis.RootCauseAnalyzer;
import com.tenacy.rootpulse.analysis.TimeWindow;
import com.tenacy.rootpulse.api.dto.AnalysisRequest;
import com.tenacy.rootpulse.api.dto.AnalysisResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/root-cause")
@RequiredArgsConstructor
@Slf4j
public class RootCauseController {

    private final RootCauseAnalyzer rootCauseAnalyzer;

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@RequestBody AnalysisRequest request) {
        TimeWindow window = request.getTimeRange() != null
                ? TimeWindow.parse(request.getTimeRange())
                : TimeWindow.of(request.getStart(), request.getEnd());

        AnalysisResult result = rootCauseAnalyzer.analyze(
                window, request.getCandidates(), AlarmType.classify(request.getAlarmRules()));
        return ResponseEntity.ok(AnalysisResponse.of(result));
    }
}
