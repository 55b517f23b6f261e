package com.designgrowth.backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateMentorshipRequest {
    @NotBlank(message = "Mentor id is required.")
    private String mentorId;

    @NotBlank(message = "Mentee id is required.")
    private String menteeId;

    private LocalDate startDate;
    private String status;
    private List<Map<String, String>> activities;
}
