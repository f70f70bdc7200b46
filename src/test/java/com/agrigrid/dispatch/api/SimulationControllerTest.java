package com.agrigrid.dispatch.api;

import com.agrigrid.core.analytics.StressIndicators;
import com.agrigrid.core.analytics.YieldForecast;
import com.agrigrid.core.engine.CellReport;
import com.agrigrid.core.engine.FarmForecast;
import com.agrigrid.core.engine.SimulationEngine;
import com.agrigrid.core.model.AgentSnapshot;
import com.agrigrid.core.model.AgentStatus;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellAttributes;
import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TelemetrySnapshot;
import com.agrigrid.core.model.WeatherState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SimulationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SimulationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SimulationEngine engine;

    private static TelemetrySnapshot snapshot(long tick) {
        return new TelemetrySnapshot(tick, Map.of(CellState.INITIAL, 390, CellState.PLOUGHED, 10), 2, 1, 4,
                List.of(new AgentSnapshot("plough-1", AgentType.PLOUGHING, AgentStatus.MOVING, Position.of(2, 3), "task-1")),
                WeatherState.defaults());
    }

    @Test
    @DisplayName("GET /simulation returns the telemetry snapshot")
    void telemetry() throws Exception {
        when(engine.telemetry()).thenReturn(snapshot(12));

        mockMvc.perform(get("/api/v1/simulation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(12))
                .andExpect(jsonPath("$.cellCounts.PLOUGHED").value(10))
                .andExpect(jsonPath("$.queuedTasks").value(4))
                .andExpect(jsonPath("$.agents[0].id").value("plough-1"))
                .andExpect(jsonPath("$.agents[0].position.x").value(2));
    }

    @Test
    @DisplayName("POST /simulation/step advances the requested ticks")
    void step() throws Exception {
        when(engine.advance(5)).thenReturn(snapshot(5));

        mockMvc.perform(post("/api/v1/simulation/step").param("ticks", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(5));
    }

    @Test
    @DisplayName("POST /simulation/step defaults to one tick")
    void stepDefault() throws Exception {
        when(engine.advance(1)).thenReturn(snapshot(1));

        mockMvc.perform(post("/api/v1/simulation/step"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(1));
    }

    @Test
    @DisplayName("POST /simulation/step outside 1..1000 returns 400")
    void stepOutOfRange() throws Exception {
        mockMvc.perform(post("/api/v1/simulation/step").param("ticks", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("between 1 and 1000")));
        mockMvc.perform(post("/api/v1/simulation/step").param("ticks", "1001"))
                .andExpect(status().isBadRequest());

        verify(engine, never()).advance(anyInt());
    }

    @Test
    @DisplayName("POST /simulation/reset returns the fresh snapshot")
    void reset() throws Exception {
        when(engine.reset()).thenReturn(snapshot(0));

        mockMvc.perform(post("/api/v1/simulation/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(0));
    }

    @Test
    @DisplayName("GET /simulation/cells/{x}/{y} returns the cell report")
    void cell() throws Exception {
        when(engine.cell(3, 4)).thenReturn(Optional.of(new CellReport(Position.of(3, 4), CellState.SOWN,
                new CellAttributes(0.4, 10, 0.0, 2), List.of("task-9"))));

        mockMvc.perform(get("/api/v1/simulation/cells/3/4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("SOWN"))
                .andExpect(jsonPath("$.attributes.waterLevel").value(0.4))
                .andExpect(jsonPath("$.pendingTasks[0]").value("task-9"));
    }

    @Test
    @DisplayName("GET /simulation/cells/{x}/{y} outside the grid returns 404")
    void cellOutOfBounds() throws Exception {
        when(engine.cell(99, 0)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/simulation/cells/99/0"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /simulation/forecast returns yield and stress")
    void forecast() throws Exception {
        when(engine.forecast()).thenReturn(new FarmForecast(8,
                new YieldForecast(3.0, 2, 5.0, 25, 33, 50.0, 1, 1),
                new StressIndicators(1, 0, 2, 50.0, 0.0, 50.0)));

        mockMvc.perform(get("/api/v1/simulation/forecast"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.yield.potentialYield").value(5.0))
                .andExpect(jsonPath("$.stress.overallHealthScore").value(50.0));
    }
}
