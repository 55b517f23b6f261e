package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateResourceRequest;
import com.designgrowth.backend.model.TrainingResource;
import com.designgrowth.backend.service.TrainingResourceService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/resources")
public class TrainingResourceController {

    @Autowired
    private TrainingResourceService trainingResourceService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateResourceRequest request) {
        return ResponseEntity.ok(new CreatedResponse(trainingResourceService.createResource(request)));
    }

    @GetMapping
    public ResponseEntity<List<TrainingResource>> list(@RequestParam(name = "tag", required = false) String tag) {
        return ResponseEntity.ok(trainingResourceService.listResources(tag));
    }
}
