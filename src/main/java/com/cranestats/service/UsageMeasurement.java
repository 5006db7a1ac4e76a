package com.cranestats.service;

import java.time.LocalDateTime;

/**
 * Usage accrued on a metric since a baseline point in time.
 */
public record UsageMeasurement(LocalDateTime baselineTime, double usage) {
}
