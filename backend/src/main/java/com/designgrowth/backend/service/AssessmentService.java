package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateAssessmentRequest;
import com.designgrowth.backend.mapper.AssessmentMapper;
import com.designgrowth.backend.model.SkillAssessment;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class AssessmentService {

    public static final int LIST_LIMIT = 100;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private AssessmentMapper assessmentMapper;

    public String createAssessment(CreateAssessmentRequest request) {
        String id = documentStore.create(assessmentMapper.toDocument(request));
        log.info("Created skill assessment {}", id);
        return id;
    }

    public List<SkillAssessment> listAssessments(String designerId) {
        return listAssessments(designerId, LIST_LIMIT);
    }

    public List<SkillAssessment> listAssessments(String designerId, int limit) {
        DocumentFilter filter = DocumentFilter.matchAll().require("designerId", designerId);
        return documentStore.list(SkillAssessment.class, filter, limit);
    }
}
