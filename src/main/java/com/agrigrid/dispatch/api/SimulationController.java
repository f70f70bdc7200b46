package com.agrigrid.dispatch.api;

import com.agrigrid.core.engine.CellReport;
import com.agrigrid.core.engine.FarmForecast;
import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.model.TelemetrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for the shared farm simulation.
 */
@RestController
@RequestMapping("/api/v1/simulation")
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationEngine engine;

    public SimulationController(SimulationEngine engine) {
        this.engine = engine;
    }

    /**
     * GET /api/v1/simulation: current telemetry snapshot.
     */
    @GetMapping
    public ResponseEntity<TelemetrySnapshot> telemetry() {
        return ResponseEntity.ok(engine.telemetry());
    }

    /**
     * POST /api/v1/simulation/step?ticks=N: advance N ticks (1..1000) and return the snapshot.
     */
    @PostMapping("/step")
    public ResponseEntity<?> step(@RequestParam(defaultValue = "1") int ticks) {
        if (ticks < 1 || ticks > SimulationEngine.MAX_TICKS_PER_CALL) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "ticks must be between 1 and " + SimulationEngine.MAX_TICKS_PER_CALL));
        }
        TelemetrySnapshot snapshot = engine.advance(ticks);
        log.debug("Stepped {} tick(s) via API, now at {}", ticks, snapshot.tick());
        return ResponseEntity.ok(snapshot);
    }

    @PostMapping("/reset")
    public ResponseEntity<TelemetrySnapshot> reset() {
        log.info("Simulation reset requested via API");
        return ResponseEntity.ok(engine.reset());
    }

    /**
     * GET /api/v1/simulation/cells/{x}/{y}: one cell's state, attributes and open tasks.
     */
    @GetMapping("/cells/{x}/{y}")
    public ResponseEntity<CellReport> cell(@PathVariable int x, @PathVariable int y) {
        return engine.cell(x, y)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/forecast")
    public ResponseEntity<FarmForecast> forecast() {
        return ResponseEntity.ok(engine.forecast());
    }
}
