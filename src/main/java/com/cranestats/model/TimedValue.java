package com.cranestats.model;

import java.time.LocalDateTime;

/**
 * A (timestamp, numeric value) point of a metric stream.
 */
public record TimedValue(LocalDateTime timestamp, double value) {

    public static TimedValue of(MetricSample sample) {
        return new TimedValue(sample.getSampleTime(), sample.getNumericValue());
    }
}
