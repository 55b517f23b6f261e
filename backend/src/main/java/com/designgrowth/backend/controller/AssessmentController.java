package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateAssessmentRequest;
import com.designgrowth.backend.model.SkillAssessment;
import com.designgrowth.backend.service.AssessmentService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {

    @Autowired
    private AssessmentService assessmentService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateAssessmentRequest request) {
        return ResponseEntity.ok(new CreatedResponse(assessmentService.createAssessment(request)));
    }

    // designer_id is mandatory here, unlike the other list endpoints
    @GetMapping
    public ResponseEntity<List<SkillAssessment>> list(@RequestParam(name = "designer_id") String designerId) {
        return ResponseEntity.ok(assessmentService.listAssessments(designerId));
    }
}
