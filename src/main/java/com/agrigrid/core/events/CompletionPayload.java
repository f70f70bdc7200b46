package com.agrigrid.core.events;

import com.agrigrid.core.model.Position;

/**
 * Completion report for a task.
 *
 * @param taskId   the finished task
 * @param cell     target cell
 * @param action   what was done, e.g. "ploughed", "watering_delayed"
 * @param yield    harvested units, 0 for anything but a harvest
 */
public record CompletionPayload(String taskId, Position cell, String action, int yield) implements MessagePayload {}
