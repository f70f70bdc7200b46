package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.CellKnowledge;
import com.agrigrid.core.model.TaskType;
import com.agrigrid.core.model.WeatherState;
import com.agrigrid.core.planner.PriorityRules;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a planner knowledge snapshot into schedule requests for what-if capacity planning.
 * Each cell the planner would act on becomes one request, scored with {@link PriorityRules}
 * and sized with per-type durations and resource draws.
 */
public class BatchPlanBuilder {

    /** Slots and resource draw of one task type. */
    public record TaskProfile(int duration, ResourceType resource, double amount) {}

    private static final Map<TaskType, TaskProfile> DEFAULT_PROFILES = new EnumMap<>(Map.of(
            TaskType.PLOUGH, new TaskProfile(2, ResourceType.FUEL, 10.0),
            TaskType.SOW, new TaskProfile(1, ResourceType.FUEL, 5.0),
            TaskType.WATER, new TaskProfile(1, ResourceType.WATER, 50.0),
            TaskType.HARVEST, new TaskProfile(2, ResourceType.FUEL, 8.0)));

    private final Map<TaskType, TaskProfile> profiles;

    public BatchPlanBuilder() {
        this(DEFAULT_PROFILES);
    }

    public BatchPlanBuilder(Map<TaskType, TaskProfile> profiles) {
        this.profiles = new EnumMap<>(profiles);
    }

    public List<ScheduleRequest> build(List<CellKnowledge> snapshot, WeatherState weather) {
        List<ScheduleRequest> requests = new ArrayList<>();
        for (CellKnowledge cell : snapshot) {
            Optional<PriorityRules.TaskScore> score = PriorityRules.score(cell.state(), weather);
            if (score.isEmpty()) continue;

            TaskType type = score.get().type();
            TaskProfile profile = profiles.get(type);
            if (profile == null) continue;

            String id = "plan-" + (requests.size() + 1);
            requests.add(new ScheduleRequest(id, type, cell.position(), score.get().priority(),
                    profile.duration(), Map.of(profile.resource(), profile.amount())));
        }
        return requests;
    }

    public static TaskProfile defaultProfile(TaskType type) {
        return DEFAULT_PROFILES.get(type);
    }
}
