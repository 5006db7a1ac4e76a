package com.cranestats.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SamplePoint {

    private LocalDateTime timestamp;
    private String rawValue;
    private Double numericValue;
}
