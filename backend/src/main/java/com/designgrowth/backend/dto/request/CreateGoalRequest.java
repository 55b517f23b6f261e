package com.designgrowth.backend.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateGoalRequest {
    @NotBlank(message = "Designer id is required.")
    private String designerId;

    @NotBlank(message = "Title is required.")
    private String title;

    private String description;
    private String competencyKey;
    private String targetDate; // ISO-8601 date or date-time
    private String status;

    @Min(value = 0, message = "Progress must be between 0 and 100.")
    @Max(value = 100, message = "Progress must be between 0 and 100.")
    private Integer progress;
}
