package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateProjectRequest;
import com.designgrowth.backend.mapper.ProjectMapper;
import com.designgrowth.backend.model.Project;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class ProjectService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private ProjectMapper projectMapper;

    public String createProject(CreateProjectRequest request) {
        String id = documentStore.create(projectMapper.toDocument(request));
        log.info("Created project {}", id);
        return id;
    }

    public List<Project> listProjects(String managerId, String designerId) {
        DocumentFilter filter = DocumentFilter.matchAll()
                .equalTo("managerId", managerId)
                .contains("designers", designerId);
        return documentStore.list(Project.class, filter, LIST_LIMIT);
    }
}
