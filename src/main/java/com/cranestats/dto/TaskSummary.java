package com.cranestats.dto;

import com.cranestats.model.TaskConfig;
import com.cranestats.model.TaskKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSummary {

    private String taskId;
    private String actionRequired;
    private String category;
    private TaskKind kind;
    private String tagName;
    private Double serviceLimit;
    private Integer serviceIntervalDays;
    private String unit;
    private Double durationHours;

    public static TaskSummary of(TaskConfig config) {
        return TaskSummary.builder()
            .taskId(config.taskId())
            .actionRequired(config.actionRequired())
            .category(config.category())
            .kind(config.kind())
            .tagName(config.tagName())
            .serviceLimit(config.serviceLimit())
            .serviceIntervalDays(config.serviceIntervalDays())
            .unit(config.unit())
            .durationHours(config.durationHours())
            .build();
    }
}
