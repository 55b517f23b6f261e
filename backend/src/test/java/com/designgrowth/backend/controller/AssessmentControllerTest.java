package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.request.CreateAssessmentRequest;
import com.designgrowth.backend.model.SkillAssessment;
import com.designgrowth.backend.service.AssessmentService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AssessmentController.class)
class AssessmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AssessmentService assessmentService;

    @Test
    void listRequiresDesignerId() throws Exception {
        mockMvc.perform(get("/api/assessments"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_PARAMETER"));

        verifyNoInteractions(assessmentService);
    }

    @Test
    void emptyDesignerIdIsForwardedRatherThanDropped() throws Exception {
        given(assessmentService.listAssessments("")).willReturn(List.of());

        mockMvc.perform(get("/api/assessments").param("designer_id", ""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(assessmentService).listAssessments("");
    }

    @Test
    void listByDesigner() throws Exception {
        SkillAssessment assessment = SkillAssessment.builder()
                .id("a1").designerId("d1").cycle("2025-H1").ratings(Map.of("impact", 3)).build();
        given(assessmentService.listAssessments("d1")).willReturn(List.of(assessment));

        mockMvc.perform(get("/api/assessments").param("designer_id", "d1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]._id").value("a1"))
                .andExpect(jsonPath("$[0].ratings.impact").value(3));
    }

    @Test
    void createPassesRawRatingsThrough() throws Exception {
        given(assessmentService.createAssessment(any(CreateAssessmentRequest.class))).willReturn("a1");

        mockMvc.perform(post("/api/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"designer_id": "d1", "cycle": "2025-H1",
                                 "ratings": {"craft_quality": 9, "impact": "great"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("a1"));

        ArgumentCaptor<CreateAssessmentRequest> captor = ArgumentCaptor.forClass(CreateAssessmentRequest.class);
        verify(assessmentService).createAssessment(captor.capture());
        assertThat(captor.getValue().getRatings())
                .containsEntry("craft_quality", 9)
                .containsEntry("impact", "great");
    }

    @Test
    void createRequiresRatings() throws Exception {
        mockMvc.perform(post("/api/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"designer_id\": \"d1\", \"cycle\": \"2025-H1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("ratings: Ratings are required."));
    }
}
