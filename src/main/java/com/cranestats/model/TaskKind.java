package com.cranestats.model;

public enum TaskKind {
    /** Triggered by a cumulative metric crossing a limit. */
    USAGE,
    /** Triggered by elapsed time since the last service. */
    CALENDAR
}
