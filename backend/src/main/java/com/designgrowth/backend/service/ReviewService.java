package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateReviewRequest;
import com.designgrowth.backend.mapper.ReviewMapper;
import com.designgrowth.backend.model.Review;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class ReviewService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private ReviewMapper reviewMapper;

    public String createReview(CreateReviewRequest request) {
        String id = documentStore.create(reviewMapper.toDocument(request));
        log.info("Created review {}", id);
        return id;
    }

    public List<Review> listReviews(String designerId, String cycle) {
        return listReviews(designerId, cycle, LIST_LIMIT);
    }

    public List<Review> listReviews(String designerId, String cycle, int limit) {
        DocumentFilter filter = DocumentFilter.matchAll()
                .equalTo("designerId", designerId)
                .equalTo("cycle", cycle);
        return documentStore.list(Review.class, filter, limit);
    }
}
