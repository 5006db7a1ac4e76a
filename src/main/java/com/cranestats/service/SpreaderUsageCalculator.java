package com.cranestats.service;

import com.cranestats.model.EntityType;
import com.cranestats.model.ServiceLogRecord;
import com.cranestats.model.TimedValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A spreader has no counter of its own. Its usage is the sum, over every crane it is
 * assigned to, of that crane's net increase since the baseline time:
 * latest - value at or before baseline (zero when the crane has no sample that early).
 *
 * Baseline time is the spreader's last service date, or the earliest sample over the
 * assigned cranes when it was never serviced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpreaderUsageCalculator implements UsageCalculator {

    private final TimeSeriesService timeSeriesService;
    private final EquipmentAssignmentService assignmentService;

    @Override
    public EntityType entityType() {
        return EntityType.SPREADER;
    }

    @Override
    public UsageMeasurement measure(String entityId, String metricName, Optional<ServiceLogRecord> lastService)
            throws UsageUnavailableException {
        List<String> cranes = assignmentService.members(entityId);
        if (cranes.isEmpty()) {
            throw new UsageUnavailableException("NO_ASSIGNMENT", "spreader " + entityId + " has no assigned cranes");
        }

        LocalDateTime baselineTime = lastService.isPresent()
            ? lastService.get().getServiceDate()
            : earliestSampleTime(cranes, metricName).orElseThrow(() -> new UsageUnavailableException(
                "NO_TELEMETRY", "no '" + metricName + "' samples on cranes " + cranes));

        double usage = 0.0;
        boolean anyTelemetry = false;
        for (String crane : cranes) {
            Optional<TimedValue> latest = timeSeriesService.getLatestValue(crane, metricName);
            if (latest.isEmpty()) {
                log.debug("Crane {} has no '{}' samples, contributes nothing to {}", crane, metricName, entityId);
                continue;
            }
            anyTelemetry = true;
            double baseline = timeSeriesService.getValueAtOrBefore(crane, metricName, baselineTime)
                .map(TimedValue::value)
                .orElse(0.0);
            double delta = latest.get().value() - baseline;
            log.debug("Spreader {} usage on {}: {} - {} = {}", entityId, crane, latest.get().value(), baseline, delta);
            usage += delta;
        }
        if (!anyTelemetry) {
            throw new UsageUnavailableException("NO_TELEMETRY", "no '" + metricName + "' samples on cranes " + cranes);
        }
        return new UsageMeasurement(baselineTime, usage);
    }

    private Optional<LocalDateTime> earliestSampleTime(List<String> cranes, String metricName) {
        return cranes.stream()
            .map(crane -> timeSeriesService.getEarliestValue(crane, metricName))
            .flatMap(Optional::stream)
            .map(TimedValue::timestamp)
            .min(LocalDateTime::compareTo);
    }
}
