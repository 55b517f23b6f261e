package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.DashboardSummaryDTO;
import com.designgrowth.backend.dto.ReferenceDataDTO;
import com.designgrowth.backend.service.DashboardService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DashboardController {

    @Autowired
    private DashboardService dashboardService;

    // Competencies and career levels; static, identical on every call
    @GetMapping("/reference")
    public ResponseEntity<ReferenceDataDTO> getReference() {
        return ResponseEntity.ok(dashboardService.getReferenceData());
    }

    @GetMapping("/summary")
    public ResponseEntity<DashboardSummaryDTO> getSummary(
            @RequestParam(name = "designer_id", required = false) String designerId) {
        return ResponseEntity.ok(dashboardService.getSummary(designerId));
    }
}
