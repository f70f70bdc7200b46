package com.agrigrid.core.engine;

import com.agrigrid.core.agents.WorkerAgent;
import com.agrigrid.core.config.SimulationProperties;
import com.agrigrid.core.metrics.FarmMetrics;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TelemetrySnapshot;
import com.agrigrid.core.scheduler.BatchPlanBuilder;
import com.agrigrid.core.scheduler.FirstFitConstraintScheduler;
import com.agrigrid.core.scheduler.ResourceType;
import com.agrigrid.core.scheduler.ScheduleRequest;
import com.agrigrid.core.scheduler.ScheduleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the shared {@link FarmSimulation} and serialises every caller (CLI, REST) onto it,
 * so two ticks never interleave.
 * <p>
 * Also runs what-if batch schedules, either from the live farm's knowledge or from
 * caller-supplied requests. Schedules never touch the running simulation.
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    public static final int MAX_TICKS_PER_CALL = 1000;

    private static final Map<AgentType, String> ROSTER_PREFIXES = Map.of(
            AgentType.PLOUGHING, "plough",
            AgentType.SOWING, "sow",
            AgentType.WATERING, "water",
            AgentType.HARVESTING, "harvest");

    private final SimulationProperties properties;
    private final FarmMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private FarmSimulation simulation;
    private int resets;

    public SimulationEngine(SimulationProperties properties, FarmMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
        this.simulation = FarmSimulation.create(properties, metrics);
    }

    /**
     * Advances the shared farm by {@code ticks} ticks.
     *
     * @throws IllegalArgumentException when ticks is outside 1..{@value #MAX_TICKS_PER_CALL}
     */
    public TelemetrySnapshot advance(int ticks) {
        if (ticks < 1 || ticks > MAX_TICKS_PER_CALL) {
            throw new IllegalArgumentException("ticks must be between 1 and " + MAX_TICKS_PER_CALL + ", got " + ticks);
        }
        lock.lock();
        try {
            TelemetrySnapshot snapshot = simulation.run(ticks);
            log.debug("Advanced {} tick(s) to tick {}", ticks, snapshot.tick());
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public TelemetrySnapshot telemetry() {
        lock.lock();
        try {
            return simulation.telemetry();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards the farm and starts over from tick 0 with the configured seed.
     */
    public TelemetrySnapshot reset() {
        lock.lock();
        try {
            simulation.workers().forEach(WorkerAgent::detach);
            simulation = FarmSimulation.create(properties, metrics);
            resets++;
            log.info("Simulation reset ({} so far)", resets);
            return simulation.telemetry();
        } finally {
            lock.unlock();
        }
    }

    public Optional<CellReport> cell(int x, int y) {
        lock.lock();
        try {
            return simulation.describeCell(Position.of(x, y));
        } finally {
            lock.unlock();
        }
    }

    public FarmForecast forecast() {
        lock.lock();
        try {
            return simulation.forecast();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builds a what-if plan from what the planner currently knows about the farm.
     */
    public ScheduleResult planFromFarm(int horizon) {
        return planFromFarm(newScheduler(horizon));
    }

    public ScheduleResult planFromFarm(FirstFitConstraintScheduler scheduler) {
        List<ScheduleRequest> requests;
        lock.lock();
        try {
            requests = new BatchPlanBuilder().build(simulation.planner().knowledgeSnapshot(),
                    simulation.weather().current());
        } finally {
            lock.unlock();
        }
        return schedule(scheduler, requests, defaultRoster());
    }

    /**
     * Schedules the given requests on a fresh scheduler with the configured resource pools.
     */
    public ScheduleResult schedule(List<ScheduleRequest> requests, Map<AgentType, List<String>> roster, int horizon) {
        return schedule(newScheduler(horizon), requests, roster);
    }

    private ScheduleResult schedule(FirstFitConstraintScheduler scheduler, List<ScheduleRequest> requests,
                                    Map<AgentType, List<String>> roster) {
        ScheduleResult result = scheduler.scheduleTasks(requests, roster);
        metrics.recordScheduleRun(result.assignments().size(), result.rejected().size());
        log.info("What-if schedule over {} slot(s): {} placed, {} rejected, makespan {}",
                scheduler.horizon(), result.assignments().size(), result.rejected().size(),
                result.metrics().makespan());
        return result;
    }

    public FirstFitConstraintScheduler newScheduler(int horizon) {
        SimulationProperties.Scheduler config = properties.getScheduler();
        Map<ResourceType, Double> pools = new EnumMap<>(ResourceType.class);
        pools.put(ResourceType.WATER, config.getWaterCapacity());
        pools.put(ResourceType.FUEL, config.getFuelCapacity());
        pools.put(ResourceType.TOOLS, config.getToolsCapacity());
        return new FirstFitConstraintScheduler(horizon, pools);
    }

    /**
     * Agent ids per type, {@code agentsPerType} of each, named like the live workers.
     */
    public Map<AgentType, List<String>> defaultRoster() {
        int perType = Math.max(1, properties.getScheduler().getAgentsPerType());
        Map<AgentType, List<String>> roster = new EnumMap<>(AgentType.class);
        ROSTER_PREFIXES.forEach((type, prefix) -> {
            List<String> ids = new ArrayList<>();
            for (int i = 1; i <= perType; i++) {
                ids.add(prefix + "-" + i);
            }
            roster.put(type, ids);
        });
        return roster;
    }

    /**
     * Read access to the live simulation under the engine lock.
     */
    public <T> T inspect(Function<FarmSimulation, T> reader) {
        lock.lock();
        try {
            return reader.apply(simulation);
        } finally {
            lock.unlock();
        }
    }

    public int resets() {
        return resets;
    }

    public int defaultHorizon() {
        return properties.getScheduler().getHorizon();
    }
}
