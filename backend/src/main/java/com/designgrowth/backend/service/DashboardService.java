package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.DashboardSummaryDTO;
import com.designgrowth.backend.dto.ReferenceDataDTO;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read-only views combining the career framework with a designer's own records.
 */
@Service
public class DashboardService {

    static final int SUMMARY_GOAL_LIMIT = 100;
    static final int SUMMARY_ASSESSMENT_LIMIT = 10;
    static final int SUMMARY_REVIEW_LIMIT = 10;

    @Autowired
    private GoalService goalService;

    @Autowired
    private AssessmentService assessmentService;

    @Autowired
    private ReviewService reviewService;

    public ReferenceDataDTO getReferenceData() {
        return ReferenceDataDTO.builder()
                .competencies(CareerFramework.COMPETENCIES)
                .careerLevels(CareerFramework.CAREER_LEVELS)
                .build();
    }

    /**
     * Without a designer id only the framework is returned.
     */
    public DashboardSummaryDTO getSummary(String designerId) {
        DashboardSummaryDTO.DashboardSummaryDTOBuilder summary = DashboardSummaryDTO.builder()
                .competencies(CareerFramework.COMPETENCIES)
                .careerLevels(CareerFramework.CAREER_LEVELS);

        if (StringUtils.hasLength(designerId)) {
            summary.goals(goalService.listGoals(designerId, SUMMARY_GOAL_LIMIT))
                    .assessments(assessmentService.listAssessments(designerId, SUMMARY_ASSESSMENT_LIMIT))
                    .reviews(reviewService.listReviews(designerId, null, SUMMARY_REVIEW_LIMIT));
        }
        return summary.build();
    }
}
