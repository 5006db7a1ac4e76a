package com.cranestats.dto;

import com.cranestats.model.EntityType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceLogRequest {

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotNull(message = "entityType is required")
    private EntityType entityType;

    @NotBlank(message = "taskId is required")
    private String taskId;

    @NotNull(message = "serviceDate is required")
    private LocalDateTime serviceDate;

    // Usage counter reading at service time, left empty for calendar tasks
    private Double servicedAtValue;

    private String servicedBy;

    @PositiveOrZero(message = "durationHours must be >= 0")
    private Double durationHours;
}
