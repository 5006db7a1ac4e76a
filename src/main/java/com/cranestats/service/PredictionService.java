package com.cranestats.service;

import com.cranestats.config.CraneStatsProperties;
import com.cranestats.config.CraneStatsProperties.DualThresholdPolicy;
import com.cranestats.dto.PredictionResult;
import com.cranestats.model.EntityType;
import com.cranestats.model.ServiceLogRecord;
import com.cranestats.model.TaskCatalog;
import com.cranestats.model.TaskConfig;
import com.cranestats.model.TaskKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Predicts when a maintenance task is next due for a crane or spreader.
 *
 * Usage-based tasks extrapolate the usage rate since the last service:
 *   rate = usage / elapsed days, daysRemaining = (serviceLimit - usage) / rate
 * Calendar-based tasks add the interval to the last service date.
 *
 * Never throws: every failure is reported in PredictionResult.error as "CODE: message".
 */
@Service
@Slf4j
public class PredictionService {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final TaskCatalog taskCatalog;
    private final ServiceHistoryService serviceHistoryService;
    private final Map<EntityType, UsageCalculator> calculators;
    private final Clock clock;
    private final DualThresholdPolicy dualThresholdPolicy;

    public PredictionService(TaskCatalog taskCatalog,
                             ServiceHistoryService serviceHistoryService,
                             List<UsageCalculator> usageCalculators,
                             Clock clock,
                             CraneStatsProperties properties) {
        this.taskCatalog = taskCatalog;
        this.serviceHistoryService = serviceHistoryService;
        this.calculators = new EnumMap<>(EntityType.class);
        for (UsageCalculator calculator : usageCalculators) {
            calculators.put(calculator.entityType(), calculator);
        }
        this.clock = clock;
        this.dualThresholdPolicy = properties.getPrediction().getDualThresholdPolicy();
    }

    public PredictionResult predictServiceDate(String entityId, EntityType entityType, String taskId) {
        PredictionResult.PredictionResultBuilder base = PredictionResult.builder()
            .entityId(entityId)
            .entityType(entityType)
            .taskId(taskId);

        if (entityType == null) {
            return base.error("UNKNOWN_ENTITY_TYPE: entity type is required").build();
        }
        Optional<TaskConfig> found = taskCatalog.find(taskId);
        if (found.isEmpty()) {
            return base.error("UNKNOWN_TASK: no task configured with id '" + taskId + "'").build();
        }
        TaskConfig task = found.get();
        base.serviceLimit(task.serviceLimit())
            .serviceIntervalDays(task.serviceIntervalDays())
            .unit(task.unit());

        try {
            Optional<ServiceLogRecord> lastService =
                serviceHistoryService.getLastServiceRecord(entityId, entityType, task.taskId());
            lastService.ifPresent(s -> base.lastServiceDate(s.getServiceDate()));

            PredictionResult result;
            if (!task.isUsageBased()) {
                result = predictByCalendar(base, task, lastService);
            } else if (task.hasCalendarInterval() && dualThresholdPolicy == DualThresholdPolicy.EARLIEST
                    && lastService.isPresent()) {
                PredictionResult byUsage = predictByUsage(copy(base), entityId, entityType, task, lastService);
                PredictionResult byCalendar = predictByCalendar(copy(base), task, lastService);
                result = earliest(byUsage, byCalendar);
            } else {
                result = predictByUsage(base, entityId, entityType, task, lastService);
            }

            log.debug("Prediction {} {} task={}: date={} daysRemaining={} value={} error={}",
                entityType, entityId, taskId, result.getPredictedDate(), result.getDaysRemaining(),
                result.getCurrentValue(), result.getError());
            return result;
        } catch (DataAccessException e) {
            log.error("Storage failure predicting {} {} task={}", entityType, entityId, taskId, e);
            return base.error("STORAGE_ERROR: " + e.getMostSpecificCause().getMessage()).build();
        } catch (RuntimeException e) {
            log.error("Unexpected failure predicting {} {} task={}", entityType, entityId, taskId, e);
            return base.error("INTERNAL_ERROR: " + e.getMessage()).build();
        }
    }

    private PredictionResult predictByCalendar(PredictionResult.PredictionResultBuilder result, TaskConfig task,
                                               Optional<ServiceLogRecord> lastService) {
        result.basis(TaskKind.CALENDAR).currentValue(0.0);
        if (!task.hasCalendarInterval()) {
            return result.error("NO_THRESHOLD: task '" + task.taskId()
                + "' has neither a usage limit nor a service interval").build();
        }
        if (lastService.isEmpty()) {
            return result.error("NO_SERVICE_BASELINE: no service recorded for task '" + task.taskId() + "'").build();
        }
        LocalDate predicted = lastService.get().getServiceDate().toLocalDate().plusDays(task.serviceIntervalDays());
        long daysRemaining = ChronoUnit.DAYS.between(LocalDate.now(clock), predicted);
        return result.predictedDate(predicted).daysRemaining(daysRemaining).build();
    }

    private PredictionResult predictByUsage(PredictionResult.PredictionResultBuilder result, String entityId,
                                            EntityType entityType, TaskConfig task,
                                            Optional<ServiceLogRecord> lastService) {
        result.basis(TaskKind.USAGE);
        UsageCalculator calculator = calculators.get(entityType);
        if (calculator == null) {
            return result.error("UNSUPPORTED_ENTITY_TYPE: no usage aggregation for " + entityType).build();
        }

        UsageMeasurement measurement;
        try {
            measurement = calculator.measure(entityId, task.tagName(), lastService);
        } catch (UsageUnavailableException e) {
            return result.error(e.getCode() + ": " + e.getMessage()).build();
        }

        double usage = measurement.usage();
        result.currentValue(usage);

        LocalDateTime now = LocalDateTime.now(clock);
        double elapsedDays = Duration.between(measurement.baselineTime(), now).getSeconds() / SECONDS_PER_DAY;
        if (elapsedDays <= 0) {
            return result.error("CANNOT_EXTRAPOLATE: no time has elapsed since " + measurement.baselineTime()).build();
        }
        double rate = usage / elapsedDays;
        if (rate <= 0 || Double.isNaN(rate)) {
            return result.error("CANNOT_EXTRAPOLATE: no usage accrued since " + measurement.baselineTime()).build();
        }

        long daysRemaining = Math.round((task.serviceLimit() - usage) / rate);
        LocalDate predicted;
        try {
            predicted = LocalDate.now(clock).plusDays(daysRemaining);
        } catch (DateTimeException | ArithmeticException e) {
            return result.error("CANNOT_EXTRAPOLATE: due date falls outside the supported date range").build();
        }
        return result
            .daysRemaining(daysRemaining)
            .predictedDate(predicted)
            .build();
    }

    /**
     * The earlier of two forecasts; a failed one loses to a successful one.
     */
    private static PredictionResult earliest(PredictionResult byUsage, PredictionResult byCalendar) {
        if (!byUsage.isSuccess()) {
            return byCalendar.isSuccess() ? withUsageValue(byCalendar, byUsage) : byUsage;
        }
        if (!byCalendar.isSuccess()) {
            return byUsage;
        }
        return byCalendar.getPredictedDate().isBefore(byUsage.getPredictedDate())
            ? withUsageValue(byCalendar, byUsage)
            : byUsage;
    }

    private static PredictionResult withUsageValue(PredictionResult calendar, PredictionResult usage) {
        calendar.setCurrentValue(usage.getCurrentValue() != null ? usage.getCurrentValue() : 0.0);
        return calendar;
    }

    private static PredictionResult.PredictionResultBuilder copy(PredictionResult.PredictionResultBuilder builder) {
        return builder.build().toBuilder();
    }
}
