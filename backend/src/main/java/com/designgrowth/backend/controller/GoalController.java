package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateGoalRequest;
import com.designgrowth.backend.model.Goal;
import com.designgrowth.backend.service.GoalService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/goals")
public class GoalController {

    @Autowired
    private GoalService goalService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateGoalRequest request) {
        return ResponseEntity.ok(new CreatedResponse(goalService.createGoal(request)));
    }

    @GetMapping
    public ResponseEntity<List<Goal>> list(@RequestParam(name = "designer_id", required = false) String designerId) {
        return ResponseEntity.ok(goalService.listGoals(designerId));
    }
}
