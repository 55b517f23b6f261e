package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Document(collection = "trainingresource")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainingResource implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String title;
    private String url;
    private String provider;
    private List<String> tags; // e.g. ["craft_quality", "leadership"]
    private Integer durationMinutes;
}
