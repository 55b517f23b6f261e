package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

@Document(collection = "review")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Review implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String designerId;
    private String cycle;
    private String status; // open | closed
    private Map<String, Integer> selfEval;
    private List<Map<String, Integer>> peerEvals;
    private Map<String, Integer> managerEval;
    private String summary;
}
