package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateMentorshipRequest;
import com.designgrowth.backend.model.Mentorship;
import com.designgrowth.backend.service.MentorshipService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/mentorships")
public class MentorshipController {

    @Autowired
    private MentorshipService mentorshipService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateMentorshipRequest request) {
        return ResponseEntity.ok(new CreatedResponse(mentorshipService.createMentorship(request)));
    }

    @GetMapping
    public ResponseEntity<List<Mentorship>> list(@RequestParam(name = "mentor_id", required = false) String mentorId,
                                                 @RequestParam(name = "mentee_id", required = false) String menteeId) {
        return ResponseEntity.ok(mentorshipService.listMentorships(mentorId, menteeId));
    }
}
