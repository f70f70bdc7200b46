package com.agrigrid.core.agents;

import com.agrigrid.core.events.DiseaseAlertPayload;
import com.agrigrid.core.events.Topics;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellAttribute;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Random;

/**
 * Periodically scans every crop for disease instead of taking task offers.
 * <p>
 * The disease estimate grows with dryness and crop maturity:
 * {@code 0.02 + (1 - water) * 0.15 + growth / 100 * 0.1 + random * 0.1}.
 * Cells above the threshold turn {@link CellState#DISEASED} and raise an alert.
 */
public class MonitoringDrone extends WorkerAgent {

    private static final Logger log = LoggerFactory.getLogger(MonitoringDrone.class);

    private final Random random;
    private final int scanInterval;
    private final double diseaseThreshold;
    private long lastScanTick;
    private int scansCompleted;

    public MonitoringDrone(String id, Position start, WorkerContext context,
                           Random random, int scanInterval, double diseaseThreshold) {
        super(id, AgentType.MONITORING, start, context);
        if (scanInterval <= 0) {
            throw new IllegalArgumentException("Scan interval must be positive, got " + scanInterval);
        }
        this.random = random;
        this.scanInterval = scanInterval;
        this.diseaseThreshold = diseaseThreshold;
    }

    @Override
    public void step() {
        long tick = clock.current();
        if (tick - lastScanTick >= scanInterval) {
            scanFarm();
            lastScanTick = tick;
        }
    }

    @Override
    protected boolean acceptsOffers() {
        return false;
    }

    @Override
    protected ExecutionOutcome execute(FarmTask task) {
        return ExecutionOutcome.skipped();
    }

    /**
     * Scan every cell once.
     *
     * @return number of cells newly flagged as diseased
     */
    public int scanFarm() {
        int flagged = 0;
        for (Position cell : world.positions()) {
            if (scanCell(cell)) flagged++;
        }
        scansCompleted++;
        log.debug("{} scan #{} flagged {} cell(s)", id, scansCompleted, flagged);
        return flagged;
    }

    boolean scanCell(Position cell) {
        CellState state = world.getCellState(cell);
        if (state != CellState.SOWN && state != CellState.GROWING && state != CellState.HEALTHY) {
            return false;
        }
        CellAttributes attrs = world.getCellAttributes(cell);
        double probability = 0.02
                + (1.0 - attrs.waterLevel()) * 0.15
                + (attrs.growthProgress() / 100.0) * 0.1
                + random.nextDouble() * 0.1;
        world.updateCellAttributes(cell, Map.of(CellAttribute.DISEASE_PROBABILITY, probability));

        if (probability <= diseaseThreshold) {
            return false;
        }
        world.setCellState(cell, CellState.DISEASED);
        channel.publish(Topics.ALERT_DISEASE, id, clock.current(),
                new DiseaseAlertPayload(cell, probability, attrs.waterLevel()));
        log.info("Disease detected at {} (p={})", cell, String.format("%.2f", probability));
        return true;
    }

    public int scansCompleted() {
        return scansCompleted;
    }
}
