package com.agrigrid.core.planner;

import com.agrigrid.core.model.FarmTask;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Max-priority queue of pending tasks. Equal priorities leave in insertion order.
 */
public class TaskQueue {

    /**
     * A queued task and the insertion sequence that breaks priority ties.
     */
    public record Entry(FarmTask task, long sequence) {}

    private static final Comparator<Entry> ORDER =
            Comparator.comparingInt((Entry e) -> e.task().priority()).reversed()
                    .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private long nextSequence;

    /**
     * Queue a new task behind every queued task of the same priority.
     */
    public Entry push(FarmTask task) {
        Entry entry = new Entry(task, nextSequence++);
        queue.add(entry);
        return entry;
    }

    /**
     * Put an entry back, keeping its original place among equal priorities.
     */
    public void requeue(Entry entry) {
        queue.add(entry);
    }

    public Entry poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Queued tasks in dequeue order.
     */
    public List<FarmTask> snapshot() {
        List<Entry> entries = new ArrayList<>(queue);
        entries.sort(ORDER);
        List<FarmTask> tasks = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            tasks.add(e.task());
        }
        return tasks;
    }
}
