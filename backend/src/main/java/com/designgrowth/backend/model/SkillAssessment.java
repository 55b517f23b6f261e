package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

@Document(collection = "skillassessment")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SkillAssessment implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String designerId;
    private String cycle; // e.g. "2025-H1"
    private Map<String, Integer> ratings; // competency key -> 1..4
    private String notes;
}
