package com.cranestats.service;

import com.cranestats.model.EntityType;
import com.cranestats.model.ServiceLogRecord;

import java.util.Optional;

/**
 * Usage aggregation strategy for one kind of equipment.
 */
public interface UsageCalculator {

    EntityType entityType();

    /**
     * Usage of {@code metricName} accrued since the last service, or since the earliest
     * available telemetry when the entity was never serviced.
     */
    UsageMeasurement measure(String entityId, String metricName, Optional<ServiceLogRecord> lastService)
        throws UsageUnavailableException;
}
