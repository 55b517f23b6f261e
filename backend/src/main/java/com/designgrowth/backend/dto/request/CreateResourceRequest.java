package com.designgrowth.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateResourceRequest {
    @NotBlank(message = "Title is required.")
    private String title;

    @NotBlank(message = "Url is required.")
    private String url;

    private String provider;
    private List<String> tags;

    @PositiveOrZero(message = "Duration cannot be negative.")
    private Integer durationMinutes;
}
