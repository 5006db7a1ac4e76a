package com.cranestats.dto;

import com.cranestats.model.EntityType;
import com.cranestats.model.TaskKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Due-date forecast for one (entity, task).
 *
 * error is null on success and "CODE: message" otherwise. A result can carry an error
 * together with a currentValue (e.g. CANNOT_EXTRAPOLATE when no usage accrued).
 * basis tells which threshold produced predictedDate.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResult {

    private String entityId;
    private EntityType entityType;
    private String taskId;
    private TaskKind basis;
    private LocalDate predictedDate;
    private Long daysRemaining;
    private Double currentValue;
    private Double serviceLimit;
    private Integer serviceIntervalDays;
    private String unit;
    private LocalDateTime lastServiceDate;
    private String error;

    public boolean isSuccess() {
        return error == null;
    }
}
