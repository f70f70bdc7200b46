package com.agrigrid.core.metrics;

import com.agrigrid.core.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the farm control loop.
 */
@Service
public class FarmMetrics {

    private final MeterRegistry registry;

    public FarmMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTick(long nanos) {
        Timer.builder("agrigrid.tick.duration")
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordTaskCreated(TaskType type) {
        Counter.builder("agrigrid.tasks.created")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordTaskAssigned(TaskType type) {
        Counter.builder("agrigrid.tasks.assigned")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    public void recordTaskCompleted(TaskType type) {
        Counter.builder("agrigrid.tasks.completed")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason reported by the worker, e.g. "NO_PATH"
     */
    public void recordTaskFailed(TaskType type, String reason) {
        Counter.builder("agrigrid.tasks.failed")
                .tag("type", type.name())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordHarvest(int yield) {
        Counter.builder("agrigrid.harvests.total")
                .register(registry)
                .increment(yield);
    }

    public void recordDiseaseAlert() {
        Counter.builder("agrigrid.alerts.disease")
                .description("Disease alerts raised by monitoring scans")
                .register(registry)
                .increment();
    }

    /**
     * Records the planner queue depth after an assignment pass.
     */
    public void recordQueueDepth(int depth) {
        DistributionSummary.builder("agrigrid.planner.queue_depth")
                .description("Tasks waiting for a worker after each planning pass")
                .register(registry)
                .record(depth);
    }

    public void recordScheduleRun(int scheduled, int rejected) {
        Counter.builder("agrigrid.schedule.tasks")
                .tag("result", "scheduled")
                .register(registry)
                .increment(scheduled);
        Counter.builder("agrigrid.schedule.tasks")
                .tag("result", "rejected")
                .register(registry)
                .increment(rejected);
    }
}
