package com.example.reconciliation.config;

import com.example.reconciliation.model.ReconciliationStatus;
import com.example.reconciliation.model.ReconciliationSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Application metrics for reconciliation runs.
 *
 * View at: http://localhost:8080/actuator/metrics
 *
 * Key metrics:
 * - reconciliation.runs.success     → Runs that produced a report
 * - reconciliation.runs.failed      → Runs aborted by malformed input or I/O errors
 * - reconciliation.rows             → Report rows written (one per distinct key)
 * - reconciliation.rows.by.status  → Report rows per status, tagged status=...
 * - reconciliation.load.time        → Reading both ledgers from storage
 * - reconciliation.engine.time      → Join + classify + serialize
 * - reconciliation.write.time       → Writing the report to storage
 * - reconciliation.run.total        → End-to-end run time
 */
@Component
@Getter
public class AppMetrics {

    // Timers (track count, total time, max, mean)
    private final Timer loadTimer;
    private final Timer engineTimer;
    private final Timer writeTimer;
    private final Timer totalRunTimer;

    // Counters
    private final Counter runsSuccessCounter;
    private final Counter runsFailedCounter;
    private final Counter rowsCounter;
    private final Map<ReconciliationStatus, Counter> statusCounters = new EnumMap<>(ReconciliationStatus.class);

    public AppMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS - Track latency (count, total, max, mean)
        // ═══════════════════════════════════════════════════════════════

        this.loadTimer = Timer.builder("reconciliation.load.time")
                .description("Time to read both ledgers from storage")
                .register(registry);

        this.engineTimer = Timer.builder("reconciliation.engine.time")
                .description("Join, classification and report serialization time")
                .register(registry);

        this.writeTimer = Timer.builder("reconciliation.write.time")
                .description("Time to write the report to storage")
                .register(registry);

        this.totalRunTimer = Timer.builder("reconciliation.run.total")
                .description("Total end-to-end run time")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS - Track counts
        // ═══════════════════════════════════════════════════════════════

        this.runsSuccessCounter = Counter.builder("reconciliation.runs.success")
                .description("Runs that produced a report")
                .register(registry);

        this.runsFailedCounter = Counter.builder("reconciliation.runs.failed")
                .description("Runs aborted before a report was written")
                .register(registry);

        this.rowsCounter = Counter.builder("reconciliation.rows")
                .description("Report rows written")
                .register(registry);

        for (ReconciliationStatus status : ReconciliationStatus.values()) {
            statusCounters.put(status, Counter.builder("reconciliation.rows.by.status")
                    .description("Report rows by status")
                    .tag("status", status.label())
                    .register(registry));
        }
    }

    public void recordLoadTime(long millis) {
        loadTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordEngineTime(long millis) {
        engineTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordWriteTime(long millis) {
        writeTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordTotalRunTime(long millis) {
        totalRunTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordRunSucceeded(ReconciliationSummary summary) {
        runsSuccessCounter.increment();
        rowsCounter.increment(summary.totalKeys());
        for (ReconciliationStatus status : ReconciliationStatus.values()) {
            statusCounters.get(status).increment(summary.countFor(status));
        }
    }

    public void incrementRunsFailed() {
        runsFailedCounter.increment();
    }

    public double statusCount(ReconciliationStatus status) {
        return statusCounters.get(status).count();
    }
}
