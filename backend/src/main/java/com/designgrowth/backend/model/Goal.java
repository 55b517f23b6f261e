package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "goal")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Goal implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String designerId;
    private String title;
    private String description;
    private String competencyKey;
    // An Instant when the client sent a valid ISO-8601 value, otherwise the raw string
    private Object targetDate;
    private String status;
    private Integer progress;
}
