package com.agrigrid.dispatch.api;

import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.scheduler.ScheduleRequest;
import com.agrigrid.core.scheduler.ScheduleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST controller for what-if batch scheduling. Never touches the running simulation.
 */
@RestController
@RequestMapping("/api/v1/schedule")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final SimulationEngine engine;

    public ScheduleController(SimulationEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/schedule: place the given tasks; returns assignments, rejected ids and metrics.
     */
    @PostMapping
    public ResponseEntity<?> schedule(@RequestBody ScheduleBody body) {
        int horizon = body.horizon() != null ? body.horizon() : engine.defaultHorizon();
        if (horizon < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "horizon must be positive"));
        }
        if (body.tasks() == null || body.tasks().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one task is required"));
        }

        List<ScheduleRequest> requests = new ArrayList<>();
        try {
            for (ScheduleBody.TaskBody task : body.tasks()) {
                requests.add(new ScheduleRequest(task.id(), task.type(), task.cell(), task.priority(),
                        task.duration(), task.resources()));
            }
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        Map<AgentType, List<String>> roster = body.roster() != null && !body.roster().isEmpty()
                ? body.roster()
                : engine.defaultRoster();
        ScheduleResult result = engine.schedule(requests, roster, horizon);
        log.info("What-if schedule via API: {} task(s), {} placed", requests.size(), result.assignments().size());
        return ResponseEntity.ok(result);
    }
}
