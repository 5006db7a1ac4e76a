package com.cranestats.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentRequest {

    @NotBlank(message = "compositeEntityId is required")
    private String compositeEntityId;

    @NotBlank(message = "memberEntityId is required")
    private String memberEntityId;
}
