package com.agrigrid.core.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Writes a scheduler's assignments (ordered by start slot) and metrics as JSON.
 */
public class ScheduleExporter {

    private static final Logger log = LoggerFactory.getLogger(ScheduleExporter.class);

    private final ObjectMapper objectMapper;

    public ScheduleExporter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public record ExportedSchedule(int horizon, List<TaskAssignment> assignments, ScheduleMetrics metrics) {}

    public ExportedSchedule snapshot(BatchScheduler scheduler) {
        List<TaskAssignment> bySlot = scheduler.assignments().stream()
                .sorted(Comparator.comparingInt(TaskAssignment::startSlot)
                        .thenComparing(TaskAssignment::agentId))
                .toList();
        return new ExportedSchedule(scheduler.horizon(), bySlot, scheduler.metrics());
    }

    public String toJson(BatchScheduler scheduler) {
        try {
            return objectMapper.writeValueAsString(snapshot(scheduler));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schedule", e);
        }
    }

    public void export(BatchScheduler scheduler, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(scheduler));
        log.info("Exported {} assignment(s) to {}", scheduler.assignments().size(), file);
    }
}
