package com.pawpal.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning, conflict detection and completion.
 */
@Service
public class PawPalMetrics {

    private final MeterRegistry registry;

    public PawPalMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long nanos) {
        Timer.builder("pawpal.planning.duration")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    /**
     * Records one generated plan and how many tasks it accepted and rejected.
     */
    public void recordPlan(int accepted, int rejected) {
        Counter.builder("pawpal.plans.total")
                .register(registry)
                .increment();
        Counter.builder("pawpal.plan.tasks")
                .tag("result", "accepted")
                .register(registry)
                .increment(accepted);
        Counter.builder("pawpal.plan.tasks")
                .tag("result", "rejected")
                .register(registry)
                .increment(rejected);
    }

    public void recordConflicts(int count) {
        Counter.builder("pawpal.conflicts.detected")
                .description("Overlapping task pairs found by conflict detection")
                .register(registry)
                .increment(count);
    }

    public void recordCompletion(String recurrence) {
        Counter.builder("pawpal.tasks.completed")
                .tag("recurrence", recurrence)
                .register(registry)
                .increment();
    }
}
