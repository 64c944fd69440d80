package com.example.reconciliation.controller;

import com.example.reconciliation.config.AppMetrics;
import com.example.reconciliation.model.ReconciliationStatus;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for reconciliation metrics summary.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("runs", getRunMetrics());
        response.put("timing", getTimingMetrics());

        return response;
    }

    /**
     * Run and row counts, rows broken down by status.
     */
    @GetMapping("/runs")
    public Map<String, Object> getRunMetrics() {
        Map<String, Object> runs = new LinkedHashMap<>();

        double success = appMetrics.getRunsSuccessCounter().count();
        double failed = appMetrics.getRunsFailedCounter().count();
        double total = success + failed;

        runs.put("total", (long) total);
        runs.put("success", (long) success);
        runs.put("failed", (long) failed);

        if (total > 0) {
            runs.put("successRate", String.format("%.2f%%", (success / total) * 100));
        } else {
            runs.put("successRate", "N/A");
        }

        runs.put("rows", (long) appMetrics.getRowsCounter().count());
        Map<String, Object> byStatus = new LinkedHashMap<>();
        for (ReconciliationStatus status : ReconciliationStatus.values()) {
            byStatus.put(status.label(), (long) appMetrics.statusCount(status));
        }
        runs.put("rowsByStatus", byStatus);

        return runs;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("totalRun", getTimerStats(appMetrics.getTotalRunTimer()));
        timing.put("load", getTimerStats(appMetrics.getLoadTimer()));
        timing.put("engine", getTimerStats(appMetrics.getEngineTimer()));
        timing.put("write", getTimerStats(appMetrics.getWriteTimer()));

        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
