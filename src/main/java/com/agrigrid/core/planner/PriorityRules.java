package com.agrigrid.core.planner;

import com.agrigrid.core.model.CellState;
import com.agrigrid.core.model.TaskType;
import com.agrigrid.core.model.WeatherState;

import java.util.Optional;

/**
 * Fixed precedence table mapping a cell state to the task it needs:
 * <pre>
 *   DISEASED          WATER    100
 *   NEED_WATER        WATER     90 (95 under heat stress, none if rain is forecast without heat)
 *   READY_TO_HARVEST  HARVEST   80
 *   SOWN              WATER     70 (50 if rain is forecast)
 *   PLOUGHED          SOW       60
 *   INITIAL           PLOUGH    50
 * </pre>
 * Growing and healthy cells need nothing.
 */
public final class PriorityRules {

    private PriorityRules() {}

    /**
     * @param type     task to create
     * @param priority its priority, higher is more urgent
     */
    public record TaskScore(TaskType type, int priority) {}

    public static Optional<TaskScore> score(CellState state, WeatherState weather) {
        boolean rain = weather.rainForecast24h();
        boolean heat = weather.heatStress();
        return switch (state) {
            case DISEASED -> Optional.of(new TaskScore(TaskType.WATER, 100));
            case NEED_WATER -> rain && !heat
                    ? Optional.empty()
                    : Optional.of(new TaskScore(TaskType.WATER, heat ? 95 : 90));
            case READY_TO_HARVEST -> Optional.of(new TaskScore(TaskType.HARVEST, 80));
            case SOWN -> Optional.of(new TaskScore(TaskType.WATER, rain ? 50 : 70));
            case PLOUGHED -> Optional.of(new TaskScore(TaskType.SOW, 60));
            case INITIAL -> Optional.of(new TaskScore(TaskType.PLOUGH, 50));
            case GROWING, HEALTHY -> Optional.empty();
        };
    }
}
