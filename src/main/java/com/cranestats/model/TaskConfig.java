package com.cranestats.model;

/**
 * Static definition of a maintainable task.
 *
 * @param tagName             canonical metric driving usage-based prediction, null for calendar-only tasks
 * @param serviceLimit        usage threshold, null when not usage-based
 * @param serviceIntervalDays calendar threshold, null when not set
 */
public record TaskConfig(
    String taskId,
    String actionRequired,
    String category,
    String tagName,
    Double serviceLimit,
    Integer serviceIntervalDays,
    String unit,
    Double durationHours
) {

    public boolean isUsageBased() {
        return tagName != null && !tagName.isBlank() && serviceLimit != null;
    }

    public boolean hasCalendarInterval() {
        return serviceIntervalDays != null;
    }

    public TaskKind kind() {
        return isUsageBased() ? TaskKind.USAGE : TaskKind.CALENDAR;
    }
}
