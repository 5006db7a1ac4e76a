package com.cranestats.service;

import com.cranestats.model.TaskCatalog;
import com.cranestats.model.TaskConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates the task table (service_config.csv).
 *
 * Rows without task_id, or with a service_limit / service_interval_days that is not a
 * non-negative number, are rejected with a warning; the rest of the table still loads.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskCatalogLoader {

    private final ResourceLoader resourceLoader;
    private final CsvTableReader csvTableReader;

    public TaskCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Task config file '{}' not found, no tasks can be predicted", location);
            return TaskCatalog.empty();
        }
        List<Map<String, String>> rows;
        try {
            rows = csvTableReader.read(resource);
        } catch (IOException | RuntimeException e) {
            log.error("Error reading task config file '{}': {}", location, e.getMessage());
            return TaskCatalog.empty();
        }

        List<TaskConfig> configs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int line = 1;
        for (Map<String, String> row : rows) {
            line++;
            try {
                TaskConfig config = toTaskConfig(row);
                if (!seen.add(config.taskId())) {
                    log.warn("Task config line {}: duplicate task_id '{}', later row wins", line, config.taskId());
                    configs.removeIf(c -> c.taskId().equals(config.taskId()));
                }
                configs.add(config);
            } catch (IllegalArgumentException e) {
                log.warn("Task config line {} rejected: {}", line, e.getMessage());
            }
        }
        TaskCatalog catalog = new TaskCatalog(configs);
        log.info("Loaded {} task definitions from '{}'", catalog.size(), location);
        return catalog;
    }

    TaskConfig toTaskConfig(Map<String, String> row) {
        String taskId = text(row.get("task_id"));
        if (taskId == null) {
            throw new IllegalArgumentException("task_id is empty");
        }
        Double limit = number(row.get("service_limit"), "service_limit");
        Double interval = number(row.get("service_interval_days"), "service_interval_days");
        if (interval != null && Math.round(interval) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("service_interval_days is out of range: '" + interval + "'");
        }
        return new TaskConfig(
            taskId,
            text(row.get("action_required")),
            text(row.get("category")),
            text(row.get("tag_name")),
            limit,
            interval != null ? (int) Math.round(interval) : null,
            text(row.get("unit")),
            number(row.get("duration_hours"), "duration_hours")
        );
    }

    private static String text(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Double number(String value, String column) {
        String trimmed = text(value);
        if (trimmed == null) {
            return null;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(column + " is not a number: '" + trimmed + "'");
        }
        if (parsed < 0 || Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new IllegalArgumentException(column + " must be a non-negative number: '" + trimmed + "'");
        }
        return parsed;
    }
}
