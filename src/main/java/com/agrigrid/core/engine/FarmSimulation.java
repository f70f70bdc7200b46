package com.agrigrid.core.engine;

import com.agrigrid.core.agents.HarvestingWorker;
import com.agrigrid.core.agents.MonitoringDrone;
import com.agrigrid.core.agents.PloughingWorker;
import com.agrigrid.core.agents.SowingWorker;
import com.agrigrid.core.agents.WateringWorker;
import com.agrigrid.core.agents.WorkerAgent;
import com.agrigrid.core.agents.WorkerContext;
import com.agrigrid.core.analytics.FarmAnalytics;
import com.agrigrid.core.config.SimulationProperties;
import com.agrigrid.core.events.MessageChannel;
import com.agrigrid.core.logging.MdcContext;
import com.agrigrid.core.metrics.FarmMetrics;
import com.agrigrid.core.model.AgentSnapshot;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TelemetrySnapshot;
import com.agrigrid.core.pathfinding.GridPathfinder;
import com.agrigrid.core.planner.MasterPlanner;
import com.agrigrid.core.world.CropGrowthModel;
import com.agrigrid.core.world.FarmWorld;
import com.agrigrid.core.world.GridFarmWorld;
import com.agrigrid.core.world.SimulationClock;
import com.agrigrid.core.world.WeatherStation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * One self-contained farm: world, weather, channel, planner and workers, driven tick by tick.
 * <p>
 * A tick runs, in order: clock advance and periodic weather update, crop growth, the planning
 * pass, delivery of the planner's messages, each worker's step in registration order, and a
 * second delivery so worker feedback reaches the planner within the same tick.
 * Not thread-safe; {@link SimulationEngine} serialises access.
 */
public class FarmSimulation {

    private static final Logger log = LoggerFactory.getLogger(FarmSimulation.class);

    private final FarmWorld world;
    private final WeatherStation weather;
    private final SimulationClock clock;
    private final MessageChannel channel;
    private final CropGrowthModel growth;
    private final MasterPlanner planner;
    private final FarmMetrics metrics;
    private final int weatherUpdateInterval;
    private final List<WorkerAgent> workers = new ArrayList<>();

    FarmSimulation(FarmWorld world, WeatherStation weather, SimulationClock clock, MessageChannel channel,
                   MasterPlanner planner, FarmMetrics metrics, int weatherUpdateInterval) {
        if (weatherUpdateInterval <= 0) {
            throw new IllegalArgumentException("Weather update interval must be positive: " + weatherUpdateInterval);
        }
        this.world = world;
        this.weather = weather;
        this.clock = clock;
        this.channel = channel;
        this.growth = new CropGrowthModel();
        this.planner = planner;
        this.metrics = metrics;
        this.weatherUpdateInterval = weatherUpdateInterval;
    }

    /**
     * Builds a farm with one worker of each type and a monitoring drone.
     */
    public static FarmSimulation create(SimulationProperties props, FarmMetrics metrics) {
        int width = props.getGrid().getWidth();
        int height = props.getGrid().getHeight();
        FarmWorld world = new GridFarmWorld(width, height);
        WeatherStation weather = new WeatherStation(new Random(props.getSeed()), props.getWeather().getRainProbability());
        SimulationClock clock = new SimulationClock();
        MessageChannel channel = new MessageChannel();

        SimulationProperties.Planner plannerProps = props.getPlanner();
        MasterPlanner planner = new MasterPlanner(world, weather, channel, clock, metrics,
                new MasterPlanner.PlannerSettings(plannerProps.getMaxTasksPerType(),
                        plannerProps.getAssignBurst(), plannerProps.getDiseaseAlertPriority()));

        FarmSimulation simulation = new FarmSimulation(world, weather, clock, channel, planner, metrics,
                props.getWeather().getUpdateInterval());

        WorkerContext context = new WorkerContext(world, channel, clock, new GridPathfinder(),
                props.getWorker().getMoveBurst());
        simulation.addWorker(new PloughingWorker("plough-1", clamp(world, 2, 2), context));
        simulation.addWorker(new SowingWorker("sow-1", clamp(world, width - 3, 2), context));
        simulation.addWorker(new WateringWorker("water-1", clamp(world, 2, height - 3), context, weather));
        simulation.addWorker(new HarvestingWorker("harvest-1", clamp(world, width - 3, height - 3), context));
        simulation.addWorker(new MonitoringDrone("drone-1", clamp(world, width / 2, 2), context,
                new Random(props.getSeed() + 1), props.getMonitoring().getScanInterval(),
                props.getMonitoring().getDiseaseThreshold()));

        log.info("Created {}x{} farm with {} worker(s), seed {}", width, height,
                simulation.workers.size(), props.getSeed());
        return simulation;
    }

    private static Position clamp(FarmWorld world, int x, int y) {
        return Position.of(Math.max(0, Math.min(world.width() - 1, x)),
                Math.max(0, Math.min(world.height() - 1, y)));
    }

    public void addWorker(WorkerAgent worker) {
        workers.add(worker);
        planner.registerWorker(worker.id(), worker.type());
    }

    /**
     * Advances exactly one tick.
     */
    public TelemetrySnapshot step() {
        long started = System.nanoTime();
        long tick = clock.advance();
        MdcContext.setTick(tick);
        try {
            if (tick % weatherUpdateInterval == 0) {
                weather.update();
                log.debug("Weather now {}", weather.current());
            }
            growth.advance(world);
            planner.step();
            channel.flush();
            for (WorkerAgent worker : workers) {
                worker.step();
            }
            channel.flush();
        } finally {
            metrics.recordTick(System.nanoTime() - started);
            MdcContext.clear();
        }
        return telemetry();
    }

    /**
     * Advances {@code ticks} ticks and returns the final snapshot.
     */
    public TelemetrySnapshot run(int ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("Tick count must not be negative: " + ticks);
        }
        TelemetrySnapshot last = telemetry();
        for (int i = 0; i < ticks; i++) {
            last = step();
        }
        return last;
    }

    public TelemetrySnapshot telemetry() {
        List<AgentSnapshot> agents = workers.stream().map(WorkerAgent::snapshot).toList();
        return new TelemetrySnapshot(clock.current(), world.countsByState(), world.harvestedCount(),
                planner.activeCount(), planner.queuedCount(), agents, weather.current());
    }

    public Optional<CellReport> describeCell(Position pos) {
        if (!world.contains(pos)) {
            return Optional.empty();
        }
        return Optional.of(new CellReport(pos, world.getCellState(pos), world.getCellAttributes(pos),
                planner.pendingTasks(pos)));
    }

    public FarmForecast forecast() {
        return new FarmForecast(clock.current(),
                FarmAnalytics.forecastYield(world, clock.current()),
                FarmAnalytics.stressIndicators(world, weather.current()));
    }

    public FarmWorld world() { return world; }
    public WeatherStation weather() { return weather; }
    public SimulationClock clock() { return clock; }
    public MessageChannel channel() { return channel; }
    public MasterPlanner planner() { return planner; }
    public List<WorkerAgent> workers() { return List.copyOf(workers); }

    public Optional<MonitoringDrone> drone() {
        return workers.stream()
                .filter(MonitoringDrone.class::isInstance)
                .map(MonitoringDrone.class::cast)
                .findFirst();
    }
}
