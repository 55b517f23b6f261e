package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateDesignerRequest;
import com.designgrowth.backend.model.Designer;
import com.designgrowth.backend.service.DesignerService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/designers")
public class DesignerController {

    @Autowired
    private DesignerService designerService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateDesignerRequest request) {
        return ResponseEntity.ok(new CreatedResponse(designerService.createDesigner(request)));
    }

    @GetMapping
    public ResponseEntity<List<Designer>> list() {
        return ResponseEntity.ok(designerService.listDesigners());
    }
}
