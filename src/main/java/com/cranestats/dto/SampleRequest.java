package com.cranestats.dto;

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
public class SampleRequest {

    @NotBlank(message = "entityId is required")
    private String entityId;

    @NotBlank(message = "metricName is required")
    private String metricName;

    @NotNull(message = "timestamp is required")
    private LocalDateTime timestamp;

    @NotBlank(message = "value is required")
    private String value;
}
