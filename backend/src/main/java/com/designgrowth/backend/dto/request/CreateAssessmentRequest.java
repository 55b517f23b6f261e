package com.designgrowth.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateAssessmentRequest {
    @NotBlank(message = "Designer id is required.")
    private String designerId;

    @NotBlank(message = "Cycle is required.")
    private String cycle;

    // Raw JSON values; coerced and clamped before storage
    @NotNull(message = "Ratings are required.")
    private Map<String, Object> ratings;

    private String notes;
}
