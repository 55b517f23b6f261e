package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateMentorshipRequest;
import com.designgrowth.backend.model.Mentorship;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;

@Component
public class MentorshipMapper {

    public static final String DEFAULT_STATUS = "active";

    public Mentorship toDocument(CreateMentorshipRequest request) {
        return Mentorship.builder()
                .mentorId(request.getMentorId())
                .menteeId(request.getMenteeId())
                .startDate(request.getStartDate())
                .status(StringUtils.hasText(request.getStatus()) ? request.getStatus() : DEFAULT_STATUS)
                .activities(request.getActivities() != null ? request.getActivities() : new ArrayList<>())
                .build();
    }
}
