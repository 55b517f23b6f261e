package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateResourceRequest;
import com.designgrowth.backend.mapper.ResourceMapper;
import com.designgrowth.backend.model.TrainingResource;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class TrainingResourceService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private ResourceMapper resourceMapper;

    public String createResource(CreateResourceRequest request) {
        String id = documentStore.create(resourceMapper.toDocument(request));
        log.info("Created training resource {}", id);
        return id;
    }

    /**
     * @param tag optional; when present only resources carrying this tag are returned
     */
    public List<TrainingResource> listResources(String tag) {
        DocumentFilter filter = DocumentFilter.matchAll().contains("tags", tag);
        return documentStore.list(TrainingResource.class, filter, LIST_LIMIT);
    }
}
