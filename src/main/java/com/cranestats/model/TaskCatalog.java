package com.cranestats.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of task definitions keyed by task id.
 */
public final class TaskCatalog {

    private final Map<String, TaskConfig> tasks;

    public TaskCatalog(Collection<TaskConfig> configs) {
        Map<String, TaskConfig> byId = new LinkedHashMap<>();
        for (TaskConfig config : configs) {
            byId.put(config.taskId(), config);
        }
        this.tasks = Collections.unmodifiableMap(byId);
    }

    public static TaskCatalog empty() {
        return new TaskCatalog(List.of());
    }

    public Optional<TaskConfig> find(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId.trim()));
    }

    public Collection<TaskConfig> all() {
        return tasks.values();
    }

    public int size() {
        return tasks.size();
    }
}
