package com.agrigrid.core.health;

import com.agrigrid.core.agents.WorkerAgent;
import com.agrigrid.core.config.SimulationProperties;
import com.agrigrid.core.engine.FarmSimulation;
import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SimulationEngine engine;
    private final int backlogWarningThreshold;

    public HealthCheckService(@Autowired(required = false) SimulationEngine engine,
                              SimulationProperties properties) {
        this.engine = engine;
        this.backlogWarningThreshold = properties.getPlanner().getBacklogWarningThreshold();
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEngine());
        results.add(checkWorkers());
        results.add(checkPlanner());
        return results;
    }

    private HealthStatus checkEngine() {
        if (engine == null) {
            return HealthStatus.down("engine", "Simulation engine not available");
        }
        try {
            long tick = engine.telemetry().tick();
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("tick", String.valueOf(tick));
            metadata.put("resets", String.valueOf(engine.resets()));
            return HealthStatus.up("engine", "Simulation at tick " + tick, metadata);
        } catch (RuntimeException e) {
            log.warn("Engine health check failed: {}", e.getMessage());
            return HealthStatus.down("engine", "Engine error: " + e.getMessage());
        }
    }

    private HealthStatus checkWorkers() {
        if (engine == null) {
            return HealthStatus.down("workers", "No simulation to inspect");
        }
        List<WorkerAgent> workers = engine.inspect(FarmSimulation::workers);
        Map<String, String> statuses = new LinkedHashMap<>();
        Set<AgentType> present = EnumSet.noneOf(AgentType.class);
        for (WorkerAgent worker : workers) {
            statuses.put(worker.id(), worker.status().name());
            present.add(worker.type());
        }

        Set<AgentType> missing = EnumSet.allOf(AgentType.class);
        missing.removeAll(present);
        if (workers.isEmpty()) {
            return HealthStatus.down("workers", "No workers registered");
        }
        if (!missing.isEmpty()) {
            return HealthStatus.degraded("workers", "No worker for " + missing, statuses);
        }
        return HealthStatus.up("workers", workers.size() + " worker(s) registered", statuses);
    }

    private HealthStatus checkPlanner() {
        if (engine == null) {
            return HealthStatus.down("planner", "No simulation to inspect");
        }
        var telemetry = engine.telemetry();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("queued", String.valueOf(telemetry.queuedTasks()));
        metadata.put("active", String.valueOf(telemetry.activeTasks()));
        metadata.put("backlogLimit", String.valueOf(backlogWarningThreshold));
        if (telemetry.queuedTasks() > backlogWarningThreshold) {
            return HealthStatus.degraded("planner",
                    "Backlog of " + telemetry.queuedTasks() + " queued task(s) exceeds " + backlogWarningThreshold,
                    metadata);
        }
        return HealthStatus.up("planner",
                telemetry.queuedTasks() + " queued, " + telemetry.activeTasks() + " active", metadata);
    }
}
