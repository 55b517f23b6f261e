package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateReviewRequest;
import com.designgrowth.backend.model.Review;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;

@Component
public class ReviewMapper {

    public static final String DEFAULT_STATUS = "open";

    public Review toDocument(CreateReviewRequest request) {
        return Review.builder()
                .designerId(request.getDesignerId())
                .cycle(request.getCycle())
                .status(StringUtils.hasText(request.getStatus()) ? request.getStatus() : DEFAULT_STATUS)
                .selfEval(request.getSelfEval())
                .peerEvals(request.getPeerEvals() != null ? request.getPeerEvals() : new ArrayList<>())
                .managerEval(request.getManagerEval())
                .summary(request.getSummary())
                .build();
    }
}
