package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Document(collection = "mentorship")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Mentorship implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String mentorId;
    private String menteeId;
    private LocalDate startDate;
    private String status; // active | completed | paused
    private List<Map<String, String>> activities;
}
