package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy first-fit placement over a fixed horizon of discrete slots.
 * <p>
 * Requests are taken in priority order (stable for equal priorities). For each request the
 * scheduler walks the agents of the matching type in roster order and, per agent, the start
 * slots from 0 upward, and accepts the first slot where the agent is free for the whole
 * duration and every required pool can cover the request. There is no backtracking and no
 * preemption: a request that finds nothing is rejected and the batch moves on.
 */
public class FirstFitConstraintScheduler implements BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(FirstFitConstraintScheduler.class);

    public static final double DEFAULT_WATER = 1000.0;
    public static final double DEFAULT_FUEL = 500.0;
    public static final double DEFAULT_TOOLS = 5.0;

    private final int horizon;
    private final Map<ResourceType, Double> capacities = new EnumMap<>(ResourceType.class);
    private final Map<ResourceType, Resource> pools = new EnumMap<>(ResourceType.class);
    private final Map<String, BitSet> reservations = new HashMap<>();
    private final List<TaskAssignment> assignments = new ArrayList<>();

    public FirstFitConstraintScheduler(int horizon) {
        this(horizon, Map.of(
                ResourceType.WATER, DEFAULT_WATER,
                ResourceType.FUEL, DEFAULT_FUEL,
                ResourceType.TOOLS, DEFAULT_TOOLS));
    }

    public FirstFitConstraintScheduler(int horizon, Map<ResourceType, Double> initialPools) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("Scheduling horizon must be positive: " + horizon);
        }
        this.horizon = horizon;
        initialPools.forEach(this::addResource);
    }

    /**
     * Adds a pool, or replaces an existing pool of the same type with a full one.
     */
    public void addResource(ResourceType type, double capacity) {
        pools.put(type, new Resource(type, capacity));
        capacities.put(type, capacity);
    }

    @Override
    public ScheduleResult scheduleTasks(List<ScheduleRequest> requests, Map<AgentType, List<String>> roster) {
        List<ScheduleRequest> ordered = new ArrayList<>(requests);
        ordered.sort(Comparator.comparingInt(ScheduleRequest::priority).reversed());

        List<TaskAssignment> placed = new ArrayList<>();
        List<String> rejected = new ArrayList<>();

        for (ScheduleRequest request : ordered) {
            List<String> agents = roster.getOrDefault(request.taskType().workerType(), List.of());
            if (agents.isEmpty()) {
                log.debug("No {} agent rostered for {}, skipping", request.taskType().workerType(), request.taskId());
                rejected.add(request.taskId());
                continue;
            }

            TaskAssignment assignment = placeFirstFit(request, agents);
            if (assignment == null) {
                log.debug("No slot or resources left for {} ({})", request.taskId(), request.taskType());
                rejected.add(request.taskId());
            } else {
                placed.add(assignment);
            }
        }

        log.info("Scheduled {} of {} task(s), {} rejected", placed.size(), requests.size(), rejected.size());
        return new ScheduleResult(placed, rejected, metrics());
    }

    private TaskAssignment placeFirstFit(ScheduleRequest request, List<String> agents) {
        for (String agentId : agents) {
            for (int slot = 0; slot <= horizon - request.duration(); slot++) {
                if (assignTask(request, agentId, slot)) {
                    return assignments.get(assignments.size() - 1);
                }
            }
        }
        return null;
    }

    /**
     * Places {@code request} on {@code agentId} starting at {@code startSlot} if the agent is free
     * and the pools can cover it. Slots and resources are committed together.
     *
     * @return false when the slot range overlaps, falls outside the horizon, or a pool is short
     */
    public boolean assignTask(ScheduleRequest request, String agentId, int startSlot) {
        if (!isAgentAvailable(agentId, startSlot, request.duration())) {
            return false;
        }
        if (!checkResourceAvailability(request.resources())) {
            return false;
        }

        request.resources().forEach((type, amount) -> pools.get(type).consume(amount));
        reservations.computeIfAbsent(agentId, id -> new BitSet(horizon))
                .set(startSlot, startSlot + request.duration());

        TaskAssignment assignment = new TaskAssignment(request.taskId(), request.taskType(), agentId,
                request.targetCell(), startSlot, request.duration(), request.priority());
        assignments.add(assignment);
        log.debug("Placed {} on {} at slot {} for {}", request.taskId(), agentId, startSlot, request.duration());
        return true;
    }

    public boolean isAgentAvailable(String agentId, int startSlot, int duration) {
        if (startSlot < 0 || duration <= 0 || startSlot > horizon - duration) {
            return false;
        }
        BitSet reserved = reservations.get(agentId);
        if (reserved == null) return true;
        int next = reserved.nextSetBit(startSlot);
        return next < 0 || next >= startSlot + duration;
    }

    /**
     * True when every requirement has a pool with enough left. A requirement on a resource
     * type without a pool is never satisfiable.
     */
    public boolean checkResourceAvailability(Map<ResourceType, Double> requirements) {
        for (Map.Entry<ResourceType, Double> requirement : requirements.entrySet()) {
            Resource pool = pools.get(requirement.getKey());
            if (pool == null || !pool.canSupply(requirement.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public ScheduleMetrics metrics() {
        int makespan = 0;
        for (TaskAssignment assignment : assignments) {
            makespan = Math.max(makespan, assignment.endSlot());
        }

        Map<ResourceType, Double> resourceUse = new EnumMap<>(ResourceType.class);
        pools.forEach((type, pool) -> resourceUse.put(type, pool.utilisation()));

        Map<String, Double> agentUse = new LinkedHashMap<>();
        reservations.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> agentUse.put(e.getKey(), (double) e.getValue().cardinality() / horizon));

        return new ScheduleMetrics(assignments.size(), makespan, resourceUse, agentUse);
    }

    @Override
    public List<TaskAssignment> assignments() {
        return List.copyOf(assignments);
    }

    public Resource resource(ResourceType type) {
        return pools.get(type);
    }

    @Override
    public int horizon() {
        return horizon;
    }

    @Override
    public void reset() {
        assignments.clear();
        reservations.clear();
        pools.clear();
        capacities.forEach((type, capacity) -> pools.put(type, new Resource(type, capacity)));
    }
}
