package com.designgrowth.backend.dto;

import com.designgrowth.backend.model.CareerLevel;
import com.designgrowth.backend.model.Competency;
import com.designgrowth.backend.model.Goal;
import com.designgrowth.backend.model.Review;
import com.designgrowth.backend.model.SkillAssessment;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Reference framework plus, when a designer was requested, that designer's goals, assessments and reviews.
 * The designer-specific lists are left out of the JSON entirely when no designer was given.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardSummaryDTO {
    private List<Competency> competencies;
    private List<CareerLevel> careerLevels;
    private List<Goal> goals;
    private List<SkillAssessment> assessments;
    private List<Review> reviews;
}
