package com.agrigrid.core.planner;

import com.agrigrid.core.events.AssignmentPayload;
import com.agrigrid.core.events.ChannelMessage;
import com.agrigrid.core.events.CompletionPayload;
import com.agrigrid.core.events.DiseaseAlertPayload;
import com.agrigrid.core.events.MessageChannel;
import com.agrigrid.core.events.TaskFailedPayload;
import com.agrigrid.core.events.Topics;
import com.agrigrid.core.metrics.FarmMetrics;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.CellKnowledge;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskStatus;
import com.agrigrid.core.model.TaskType;
import com.agrigrid.core.model.WeatherState;
import com.agrigrid.core.world.FarmWorld;
import com.agrigrid.core.world.SimulationClock;
import com.agrigrid.core.world.WeatherStation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Central coordinator: keeps a per-cell knowledge read-model, turns it into prioritised
 * tasks and hands them to registered workers over the {@link MessageChannel}.
 * <p>
 * Per tick the planner refreshes its knowledge from the world, scores every cell without
 * an open task, and offers up to {@code assignBurst} queued tasks to available workers.
 * A cell has at most one open task of each type. Worker feedback arrives on
 * {@link Topics#TASK_COMPLETED}, {@link Topics#TASK_FAILED} and {@link Topics#ALERT_DISEASE}.
 */
public class MasterPlanner {

    private static final Logger log = LoggerFactory.getLogger(MasterPlanner.class);

    public static final String PLANNER_ID = "master";

    private static final int CLOSED_HISTORY = 500;

    private final FarmWorld world;
    private final WeatherStation weather;
    private final MessageChannel channel;
    private final SimulationClock clock;
    private final FarmMetrics metrics;
    private final int maxTasksPerType;
    private final int assignBurst;
    private final int diseaseAlertPriority;

    private final Map<Position, CellKnowledge> knowledge = new LinkedHashMap<>();
    private final Map<Position, List<String>> pendingByCell = new HashMap<>();
    /** Every open task, queued or assigned, by id. */
    private final Map<String, FarmTask> openTasks = new HashMap<>();
    private final TaskQueue queue = new TaskQueue();
    private final Map<String, FarmTask> activeAssignments = new LinkedHashMap<>();
    private final Map<String, TaskQueue.Entry> assignedEntries = new HashMap<>();
    private final Map<AgentType, Set<String>> workerRegistry = new EnumMap<>(AgentType.class);
    /** worker id -> id of the task it currently holds */
    private final Map<String, String> busyWorkers = new HashMap<>();
    private final Map<String, FarmTask> recentlyClosed = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, FarmTask> eldest) {
            return size() > CLOSED_HISTORY;
        }
    };

    private long taskCounter;
    private int completedCount;
    private int failedCount;

    public MasterPlanner(FarmWorld world, WeatherStation weather, MessageChannel channel,
                         SimulationClock clock, FarmMetrics metrics, PlannerSettings settings) {
        if (settings.maxTasksPerType() <= 0 || settings.assignBurst() <= 0) {
            throw new IllegalArgumentException("Planner caps must be positive: " + settings);
        }
        this.world = world;
        this.weather = weather;
        this.channel = channel;
        this.clock = clock;
        this.metrics = metrics;
        this.maxTasksPerType = settings.maxTasksPerType();
        this.assignBurst = settings.assignBurst();
        this.diseaseAlertPriority = settings.diseaseAlertPriority();

        refreshKnowledge();

        channel.subscribe(Topics.TASK_COMPLETED, this::onTaskCompleted);
        channel.subscribe(Topics.TASK_FAILED, this::onTaskFailed);
        channel.subscribe(Topics.ALERT_DISEASE, this::onDiseaseAlert);
    }

    /**
     * Tunables of the planning pass.
     *
     * @param maxTasksPerType      open tasks allowed per task type
     * @param assignBurst          queued tasks considered per tick
     * @param diseaseAlertPriority priority of the water task raised by a disease alert
     */
    public record PlannerSettings(int maxTasksPerType, int assignBurst, int diseaseAlertPriority) {

        public static PlannerSettings defaults() {
            return new PlannerSettings(10, 20, 95);
        }
    }

    public void registerWorker(String workerId, AgentType type) {
        workerRegistry.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(workerId);
        log.info("Registered {} worker {}", type, workerId);
    }

    /**
     * One planning cycle: refresh knowledge, create tasks, assign tasks.
     */
    public void step() {
        refreshKnowledge();
        int created = planTasks();
        int assigned = assignPendingTasks();
        metrics.recordQueueDepth(queue.size());
        log.debug("Planned {} new task(s), assigned {}, queued {}, active {}",
                created, assigned, queue.size(), activeAssignments.size());
    }

    /**
     * Rebuilds the knowledge read-model from the world. Pending task lists are the planner's own.
     */
    public void refreshKnowledge() {
        long tick = clock.current();
        for (Position pos : world.positions()) {
            knowledge.put(pos, new CellKnowledge(pos, world.getCellState(pos), world.getCellAttributes(pos),
                    tick, pendingByCell.getOrDefault(pos, List.of())));
        }
    }

    /**
     * Scores every cell without an open task and enqueues what it needs. Per type, the tasks
     * currently assigned to workers plus those created in this pass never exceed
     * {@code maxTasksPerType}; tasks still waiting in the queue do not count.
     *
     * @return number of tasks created
     */
    public int planTasks() {
        Map<TaskType, Integer> inFlight = new EnumMap<>(TaskType.class);
        for (FarmTask task : activeAssignments.values()) {
            inFlight.merge(task.type(), 1, Integer::sum);
        }

        WeatherState conditions = weather.current();
        int created = 0;
        for (CellKnowledge cell : knowledge.values()) {
            if (cell.hasPendingTasks()) continue;

            Optional<PriorityRules.TaskScore> score = PriorityRules.score(cell.state(), conditions);
            if (score.isEmpty()) continue;

            TaskType type = score.get().type();
            int count = inFlight.getOrDefault(type, 0);
            if (count >= maxTasksPerType) continue;

            createTask(type, cell.position(), score.get().priority());
            inFlight.put(type, count + 1);
            created++;
        }
        return created;
    }

    /**
     * Creates a pending task and queues it. Does not apply the per-type cap.
     */
    public FarmTask createTask(TaskType type, Position cell, int priority) {
        FarmTask task = FarmTask.pending("task-" + (++taskCounter), type, cell, priority, clock.current());
        queue.push(task);
        openTasks.put(task.id(), task);
        addPending(cell, task.id());
        metrics.recordTaskCreated(type);
        log.debug("Created {} {} for {} (priority {})", task.id(), type, cell, priority);
        return task;
    }

    /**
     * Offers up to {@code assignBurst} queued tasks, highest priority first, to available workers.
     * Tasks without an available worker go back to the queue and stay pending.
     *
     * @return number of tasks assigned
     */
    public int assignPendingTasks() {
        int burst = Math.min(assignBurst, queue.size());
        List<TaskQueue.Entry> deferred = new ArrayList<>();
        int assigned = 0;

        for (int i = 0; i < burst; i++) {
            TaskQueue.Entry entry = queue.poll();
            if (entry == null) break;

            AgentType workerType = entry.task().type().workerType();
            String workerId = availableWorker(workerType);
            if (workerId == null) {
                deferred.add(entry);
                continue;
            }
            assign(entry, workerId);
            assigned++;
        }

        deferred.forEach(queue::requeue);
        return assigned;
    }

    private void assign(TaskQueue.Entry entry, String workerId) {
        FarmTask task = entry.task().assignedTo(workerId);
        openTasks.put(task.id(), task);
        activeAssignments.put(task.id(), task);
        assignedEntries.put(task.id(), entry);
        busyWorkers.put(workerId, task.id());

        AgentType workerType = task.type().workerType();
        channel.publish(Topics.TASK_ASSIGNED, PLANNER_ID, clock.current(),
                new AssignmentPayload(task, workerType, workerId));
        metrics.recordTaskAssigned(task.type());
        log.debug("Assigned {} to {}", task.id(), workerId);
    }

    private String availableWorker(AgentType type) {
        Set<String> workers = workerRegistry.get(type);
        if (workers == null) return null;
        for (String workerId : workers) {
            if (!busyWorkers.containsKey(workerId)) return workerId;
        }
        return null;
    }

    void onTaskCompleted(ChannelMessage message) {
        CompletionPayload payload = message.payloadAs(CompletionPayload.class);
        if (payload == null) return;

        FarmTask task = closeAssignment(payload.taskId(), TaskStatus.COMPLETED);
        if (task == null) {
            log.debug("Completion for unknown task {} ignored", payload.taskId());
            return;
        }
        completedCount++;
        metrics.recordTaskCompleted(task.type());
        if (payload.yield() > 0) {
            metrics.recordHarvest(payload.yield());
        }
        log.debug("{} completed by {} ({})", task.id(), message.senderId(), payload.action());
    }

    void onTaskFailed(ChannelMessage message) {
        TaskFailedPayload payload = message.payloadAs(TaskFailedPayload.class);
        if (payload == null) return;

        if (payload.reason() == TaskFailedPayload.Reason.WORKER_BUSY) {
            requeueRefused(payload.taskId());
            return;
        }

        FarmTask task = closeAssignment(payload.taskId(), TaskStatus.FAILED);
        if (task == null) return;
        failedCount++;
        metrics.recordTaskFailed(task.type(), payload.reason().name());
        log.warn("{} failed on {} ({}), cell will be re-planned", task.id(), payload.cell(), payload.reason());
    }

    void onDiseaseAlert(ChannelMessage message) {
        DiseaseAlertPayload payload = message.payloadAs(DiseaseAlertPayload.class);
        if (payload == null || !world.contains(payload.cell())) return;

        metrics.recordDiseaseAlert();
        if (hasPendingTask(payload.cell(), TaskType.WATER)) {
            log.debug("Disease alert for {} already covered by an open water task", payload.cell());
            return;
        }
        createTask(TaskType.WATER, payload.cell(), diseaseAlertPriority);
        log.info("Disease alert at {}: urgent water task queued", payload.cell());
    }

    /**
     * Removes an assigned task from the active map and its cell's pending list.
     *
     * @return the closed task with its final status, or null if it was not active
     */
    private FarmTask closeAssignment(String taskId, TaskStatus status) {
        FarmTask active = activeAssignments.remove(taskId);
        if (active == null) return null;
        assignedEntries.remove(taskId);
        openTasks.remove(taskId);
        busyWorkers.remove(active.assignedTo());
        removePending(active.targetCell(), taskId);
        FarmTask closed = active.finished(status, clock.current());
        recentlyClosed.put(taskId, closed);
        return closed;
    }

    private void requeueRefused(String taskId) {
        FarmTask task = activeAssignments.remove(taskId);
        if (task == null) return;
        busyWorkers.remove(task.assignedTo());
        TaskQueue.Entry entry = assignedEntries.remove(taskId);
        openTasks.put(taskId, entry.task());
        queue.requeue(entry);
        log.debug("{} refused by {}, back in queue", taskId, task.assignedTo());
    }

    private boolean hasPendingTask(Position cell, TaskType type) {
        for (String id : pendingByCell.getOrDefault(cell, List.of())) {
            FarmTask open = openTasks.get(id);
            if (open != null && open.type() == type) return true;
        }
        return false;
    }

    private void addPending(Position cell, String taskId) {
        List<String> ids = new ArrayList<>(pendingByCell.getOrDefault(cell, List.of()));
        ids.add(taskId);
        pendingByCell.put(cell, List.copyOf(ids));
        syncKnowledge(cell);
    }

    private void removePending(Position cell, String taskId) {
        List<String> ids = new ArrayList<>(pendingByCell.getOrDefault(cell, List.of()));
        ids.remove(taskId);
        if (ids.isEmpty()) {
            pendingByCell.remove(cell);
        } else {
            pendingByCell.put(cell, List.copyOf(ids));
        }
        syncKnowledge(cell);
    }

    private void syncKnowledge(Position cell) {
        CellKnowledge current = knowledge.get(cell);
        if (current == null) return;
        knowledge.put(cell, new CellKnowledge(cell, current.state(), current.attributes(), current.lastUpdated(),
                pendingByCell.getOrDefault(cell, List.of())));
    }

    public CellKnowledge knowledge(Position cell) {
        return knowledge.get(cell);
    }

    public List<CellKnowledge> knowledgeSnapshot() {
        return List.copyOf(knowledge.values());
    }

    public List<String> pendingTasks(Position cell) {
        return pendingByCell.getOrDefault(cell, List.of());
    }

    public Map<String, FarmTask> activeAssignments() {
        return Map.copyOf(activeAssignments);
    }

    public List<FarmTask> queuedTasks() {
        return queue.snapshot();
    }

    public int queuedCount() {
        return queue.size();
    }

    public int activeCount() {
        return activeAssignments.size();
    }

    public long createdCount() {
        return taskCounter;
    }

    public int completedCount() {
        return completedCount;
    }

    public int failedCount() {
        return failedCount;
    }

    public Map<AgentType, Set<String>> registeredWorkers() {
        Map<AgentType, Set<String>> copy = new EnumMap<>(AgentType.class);
        workerRegistry.forEach((type, ids) -> copy.put(type, Set.copyOf(ids)));
        return copy;
    }

    /**
     * Open tasks report their live status; closed tasks are remembered for a bounded window.
     */
    public Optional<FarmTask> lookup(String taskId) {
        FarmTask task = openTasks.get(taskId);
        if (task != null) return Optional.of(task);
        return Optional.ofNullable(recentlyClosed.get(taskId));
    }
}
