package com.cranestats.dto;

import com.cranestats.model.EntityType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceWindowRequest {

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotNull(message = "entityType is required")
    private EntityType entityType;

    @NotNull(message = "fromDatetime is required")
    private LocalDateTime fromDatetime;

    @NotNull(message = "toDatetime is required")
    private LocalDateTime toDatetime;

    private String serviceType;
    private String taskDescription;
    private String notes;
}
