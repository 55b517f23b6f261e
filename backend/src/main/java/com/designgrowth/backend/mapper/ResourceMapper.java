package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateResourceRequest;
import com.designgrowth.backend.model.TrainingResource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

@Component
public class ResourceMapper {

    public TrainingResource toDocument(CreateResourceRequest request) {
        return TrainingResource.builder()
                .title(request.getTitle())
                .url(request.getUrl())
                .provider(request.getProvider())
                .tags(request.getTags() != null ? request.getTags() : new ArrayList<>())
                .durationMinutes(request.getDurationMinutes())
                .build();
    }
}
