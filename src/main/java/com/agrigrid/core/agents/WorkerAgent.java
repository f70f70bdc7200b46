package com.agrigrid.core.agents;

import com.agrigrid.core.events.AssignmentPayload;
import com.agrigrid.core.events.ChannelMessage;
import com.agrigrid.core.events.CompletionPayload;
import com.agrigrid.core.events.MessageChannel;
import com.agrigrid.core.events.StatusReportPayload;
import com.agrigrid.core.events.TaskFailedPayload;
import com.agrigrid.core.events.Topics;
import com.agrigrid.core.logging.MdcContext;
import com.agrigrid.core.model.AgentSnapshot;
import com.agrigrid.core.model.AgentStatus;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.FarmTask;
import com.agrigrid.core.model.Position;
import com.agrigrid.core.pathfinding.GridPathfinder;
import com.agrigrid.core.world.FarmWorld;
import com.agrigrid.core.world.SimulationClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Base lifecycle shared by all worker agents: {@code IDLE -> MOVING -> WORKING -> COMPLETED -> IDLE}.
 * <p>
 * A worker holds at most one task. It accepts an offer only while idle and only for its
 * own type; offers of its type that arrive while busy are refused with a
 * {@link TaskFailedPayload.Reason#WORKER_BUSY} report so the planner can re-offer.
 * Subclasses supply the task effect in {@link #execute(FarmTask)}.
 */
public abstract class WorkerAgent {

    private static final Logger log = LoggerFactory.getLogger(WorkerAgent.class);

    protected final String id;
    protected final AgentType type;
    protected final FarmWorld world;
    protected final MessageChannel channel;
    protected final SimulationClock clock;
    private final GridPathfinder pathfinder;
    private final int moveBurst;
    private final MessageChannel.Subscription subscription;

    private AgentStatus status = AgentStatus.IDLE;
    private Position position;
    private FarmTask currentTask;
    private Position targetPosition;
    private final Deque<Position> path = new ArrayDeque<>();
    private ExecutionOutcome lastOutcome;

    protected WorkerAgent(String id, AgentType type, Position start, WorkerContext context) {
        if (context.moveBurst() <= 0) {
            throw new IllegalArgumentException("Move burst must be positive, got " + context.moveBurst());
        }
        this.id = id;
        this.type = type;
        this.position = start;
        this.world = context.world();
        this.channel = context.channel();
        this.clock = context.clock();
        this.pathfinder = context.pathfinder();
        this.moveBurst = context.moveBurst();
        this.subscription = channel.subscribe(Topics.TASK_ASSIGNED, this::receiveTask);
    }

    /**
     * Advance the state machine by one tick.
     */
    public void step() {
        switch (status) {
            case IDLE -> { }
            case MOVING -> move();
            case WORKING -> work();
            case COMPLETED -> report();
        }
    }

    /**
     * Handles a {@link Topics#TASK_ASSIGNED} message.
     */
    protected void receiveTask(ChannelMessage message) {
        AssignmentPayload offer = message.payloadAs(AssignmentPayload.class);
        if (offer == null || offer.task() == null || !acceptsOffers()) return;
        if (offer.workerType() != type) return;
        if (offer.workerId() != null && !offer.workerId().equals(id)) return;

        FarmTask task = offer.task();
        if (status != AgentStatus.IDLE) {
            log.debug("{} busy with {}, refusing {}", id, currentTaskId(), task.id());
            publishFailure(task, TaskFailedPayload.Reason.WORKER_BUSY);
            return;
        }

        currentTask = task;
        targetPosition = task.targetCell();
        List<Position> route = pathfinder.findPath(position, targetPosition, world.width(), world.height(), Set.of());
        if (route.isEmpty()) {
            log.warn("{} found no path from {} to {}, dropping {}", id, position, targetPosition, task.id());
            publishFailure(task, TaskFailedPayload.Reason.NO_PATH);
            clearTask();
            return;
        }

        path.clear();
        path.addAll(route);
        if (position.equals(path.peekFirst())) {
            path.pollFirst();
        }
        status = AgentStatus.MOVING;
        log.debug("{} accepted {} at {}, {} step(s) away", id, task.id(), targetPosition, path.size());
    }

    /**
     * Whether this worker takes task offers at all.
     */
    protected boolean acceptsOffers() {
        return true;
    }

    /**
     * Apply the task's effect to the current state of its target cell.
     */
    protected abstract ExecutionOutcome execute(FarmTask task);

    private void move() {
        int steps = Math.min(moveBurst, path.size());
        for (int i = 0; i < steps; i++) {
            position = path.pollFirst();
            if (position.equals(targetPosition)) break;
        }
        if (path.isEmpty() || position.equals(targetPosition)) {
            status = AgentStatus.WORKING;
        }
    }

    private void work() {
        if (currentTask == null) {
            status = AgentStatus.IDLE;
            return;
        }
        MdcContext.setTask(clock.current(), currentTask.id(), type.name());
        try {
            lastOutcome = execute(currentTask);
            log.debug("{} executed {} on {}: {}", id, currentTask.id(), currentTask.targetCell(), lastOutcome.kind());
        } finally {
            MdcContext.clearTask();
        }
        status = AgentStatus.COMPLETED;
    }

    private void report() {
        if (currentTask != null) {
            if (lastOutcome != null && lastOutcome.completed()) {
                channel.publish(Topics.TASK_COMPLETED, id, clock.current(), new CompletionPayload(
                        currentTask.id(), currentTask.targetCell(), lastOutcome.action(), lastOutcome.yield()));
            } else {
                log.info("{} abandoned {}: cell {} no longer eligible for {}",
                        id, currentTask.id(), currentTask.targetCell(), currentTask.type());
                publishFailure(currentTask, TaskFailedPayload.Reason.PRECONDITION_FAILED);
            }
            channel.publish(Topics.STATUS_UPDATE, id, clock.current(), new StatusReportPayload(
                    id, type, position, status, currentTask.id(),
                    type.name().toLowerCase() + " agent completed task"));
        }
        clearTask();
    }

    private void publishFailure(FarmTask task, TaskFailedPayload.Reason reason) {
        channel.publish(Topics.TASK_FAILED, id, clock.current(),
                new TaskFailedPayload(task.id(), task.targetCell(), reason));
    }

    private void clearTask() {
        currentTask = null;
        targetPosition = null;
        lastOutcome = null;
        path.clear();
        status = AgentStatus.IDLE;
    }

    /**
     * Stop receiving task offers.
     */
    public void detach() {
        subscription.unsubscribe();
    }

    public String id() { return id; }
    public AgentType type() { return type; }
    public AgentStatus status() { return status; }
    public Position position() { return position; }
    public FarmTask currentTask() { return currentTask; }
    public Position targetPosition() { return targetPosition; }
    public List<Position> remainingPath() { return List.copyOf(path); }

    private String currentTaskId() {
        return currentTask != null ? currentTask.id() : null;
    }

    public AgentSnapshot snapshot() {
        return new AgentSnapshot(id, type, status, position, currentTaskId());
    }
}
