package com.designgrowth.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateReviewRequest {
    @NotBlank(message = "Designer id is required.")
    private String designerId;

    @NotBlank(message = "Cycle is required.")
    private String cycle;

    private String status;
    private Map<String, Integer> selfEval;
    private List<Map<String, Integer>> peerEvals;
    private Map<String, Integer> managerEval;
    private String summary;
}
