package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateProjectRequest;
import com.designgrowth.backend.model.Project;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

@Component
public class ProjectMapper {

    public Project toDocument(CreateProjectRequest request) {
        return Project.builder()
                .name(request.getName())
                .description(request.getDescription())
                .managerId(request.getManagerId())
                .designers(request.getDesigners() != null ? request.getDesigners() : new ArrayList<>())
                .stages(request.getStages() != null ? request.getStages() : new ArrayList<>())
                .build();
    }
}
