package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateProjectRequest;
import com.designgrowth.backend.model.Project;
import com.designgrowth.backend.service.ProjectService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    @Autowired
    private ProjectService projectService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateProjectRequest request) {
        return ResponseEntity.ok(new CreatedResponse(projectService.createProject(request)));
    }

    @GetMapping
    public ResponseEntity<List<Project>> list(@RequestParam(name = "manager_id", required = false) String managerId,
                                              @RequestParam(name = "designer_id", required = false) String designerId) {
        return ResponseEntity.ok(projectService.listProjects(managerId, designerId));
    }
}
