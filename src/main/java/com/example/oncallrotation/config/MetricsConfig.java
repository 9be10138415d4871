package com.example.oncallrotation.config;

import com.example.oncallrotation.domain.repository.RotationTaskRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for rotation runs and trigger reconciliation.
 * <p>
 * Exposes Prometheus metrics for:
 * - Active and retired task counts
 * - Roster syncs by outcome
 * - Triggers created and deleted
 * - Run duration
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final RotationTaskRepository taskRepository;

    private final AtomicLong activeTasks = new AtomicLong(0);
    private final AtomicLong retiredTasks = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("oncall_rotation_tasks", activeTasks, AtomicLong::get)
                .tag("state", "active")
                .description("Number of rotation tasks by state")
                .register(meterRegistry);

        Gauge.builder("oncall_rotation_tasks", retiredTasks, AtomicLong::get)
                .tag("state", "retired")
                .description("Number of rotation tasks by state")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${oncall-rotation.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        activeTasks.set(taskRepository.countByNextOccurrenceUtcGreaterThan(0));
        retiredTasks.set(taskRepository.countByNextOccurrenceUtcLessThanEqual(0));
    }

    public Timer.Sample startRunTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRun(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder("oncall_rotation_run_time")
                .tag("success", String.valueOf(success))
                .description("Duration of one rotation run")
                .register(meterRegistry));
    }

    /**
     * @param outcome "changed", "unchanged" or "failed"
     */
    public void recordSync(String outcome) {
        meterRegistry.counter("oncall_rotation_syncs", "outcome", outcome).increment();
    }

    public void recordTriggerCreated() {
        meterRegistry.counter("oncall_rotation_triggers_created").increment();
    }

    /**
     * @param reason "redundant" or "stale"
     */
    public void recordTriggerDeleted(String reason) {
        meterRegistry.counter("oncall_rotation_triggers_deleted", "reason", reason).increment();
    }
}
