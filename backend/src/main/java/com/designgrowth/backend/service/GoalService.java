package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateGoalRequest;
import com.designgrowth.backend.mapper.GoalMapper;
import com.designgrowth.backend.model.Goal;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class GoalService {

    public static final int LIST_LIMIT = 500;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private GoalMapper goalMapper;

    public String createGoal(CreateGoalRequest request) {
        String id = documentStore.create(goalMapper.toDocument(request));
        log.info("Created goal {}", id);
        return id;
    }

    /**
     * @param designerId optional; when blank every goal matches
     */
    public List<Goal> listGoals(String designerId) {
        return listGoals(designerId, LIST_LIMIT);
    }

    public List<Goal> listGoals(String designerId, int limit) {
        DocumentFilter filter = DocumentFilter.matchAll().equalTo("designerId", designerId);
        return documentStore.list(Goal.class, filter, limit);
    }
}
