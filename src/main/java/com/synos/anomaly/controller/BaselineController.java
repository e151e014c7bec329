package com.synos.anomaly.controller;

import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.TimeWindow;
import com.synos.anomaly.service.MetricBaselineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * baseline 조회 API 컨트롤러
 */
@RestController
@RequestMapping("/api/baselines")
@RequiredArgsConstructor
@Slf4j
public class BaselineController {

    private final MetricBaselineService baselineService;

    /**
     * GET /api/baselines                          -> 전체
     * GET /api/baselines?metric=&source=&window=  -> 단건 (없으면 404)
     */
    @GetMapping
    public ResponseEntity<?> getBaselines(
            @RequestParam(required = false) String metric,
            @RequestParam(required = false) String source,
            @RequestParam(defaultValue = "hourly") String window
    ) {
        if (metric == null && source == null) {
            List<BaselineProfile> all = new ArrayList<>(baselineService.getAllBaselines());
            all.sort(Comparator.comparing(BaselineProfile::key));
            return ResponseEntity.ok(all);
        }
        if (metric == null || source == null) {
            throw new IllegalArgumentException("metric and source must be given together");
        }

        TimeWindow timeWindow = TimeWindow.fromString(window);
        return baselineService.getBaseline(metric, source, timeWindow)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    Map<String, Object> error = new HashMap<>();
                    error.put("status", "error");
                    error.put("message", "Baseline not found");
                    error.put("error", metric + "_" + source + "_" + timeWindow.key());
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
                });
    }

    /**
     * 모든 baseline 즉시 재계산
     * POST /api/baselines/refresh
     */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        int refreshed = baselineService.refreshAll();
        log.info("baseline 수동 갱신: {}개 키", refreshed);

        Map<String, Object> result = new HashMap<>();
        result.put("status", "success");
        result.put("refreshed_keys", refreshed);
        result.put("baselines_count", baselineService.baselineCount());
        return ResponseEntity.ok(result);
    }
}
