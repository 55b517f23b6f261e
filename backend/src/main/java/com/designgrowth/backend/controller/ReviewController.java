package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateReviewRequest;
import com.designgrowth.backend.model.Review;
import com.designgrowth.backend.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    @Autowired
    private ReviewService reviewService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateReviewRequest request) {
        return ResponseEntity.ok(new CreatedResponse(reviewService.createReview(request)));
    }

    @GetMapping
    public ResponseEntity<List<Review>> list(@RequestParam(name = "designer_id", required = false) String designerId,
                                             @RequestParam(name = "cycle", required = false) String cycle) {
        return ResponseEntity.ok(reviewService.listReviews(designerId, cycle));
    }
}
