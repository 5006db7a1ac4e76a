package com.cranestats.service;

import com.cranestats.model.EntityType;
import com.cranestats.model.ServiceLogRecord;
import com.cranestats.model.TimedValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A crane reads its own counter: latest sample minus the baseline value.
 *
 * Baseline value, in order of preference: the counter reading recorded with the service,
 * the last sample at or before the service date, zero. Without a service the earliest
 * sample is the baseline.
 */
@Component
@RequiredArgsConstructor
public class CraneUsageCalculator implements UsageCalculator {

    private final TimeSeriesService timeSeriesService;

    @Override
    public EntityType entityType() {
        return EntityType.CRANE;
    }

    @Override
    public UsageMeasurement measure(String entityId, String metricName, Optional<ServiceLogRecord> lastService)
            throws UsageUnavailableException {
        TimedValue latest = timeSeriesService.getLatestValue(entityId, metricName)
            .orElseThrow(() -> new UsageUnavailableException("NO_TELEMETRY",
                "no '" + metricName + "' samples for " + entityId));

        if (lastService.isPresent()) {
            ServiceLogRecord service = lastService.get();
            LocalDateTime baselineTime = service.getServiceDate();
            double baselineValue = service.getServicedAtValue() != null
                ? service.getServicedAtValue()
                : timeSeriesService.getValueAtOrBefore(entityId, metricName, baselineTime)
                    .map(TimedValue::value)
                    .orElse(0.0);
            return new UsageMeasurement(baselineTime, latest.value() - baselineValue);
        }

        TimedValue earliest = timeSeriesService.getEarliestValue(entityId, metricName).orElse(latest);
        return new UsageMeasurement(earliest.timestamp(), latest.value() - earliest.value());
    }
}
