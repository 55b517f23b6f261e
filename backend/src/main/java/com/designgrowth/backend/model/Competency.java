package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Axis of professional skill, e.g. product_strategy or craft_quality. Reference data only, never stored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Competency {
    private String key;
    private String title;
    private String description;
}
