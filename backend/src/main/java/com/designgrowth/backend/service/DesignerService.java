package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateDesignerRequest;
import com.designgrowth.backend.mapper.DesignerMapper;
import com.designgrowth.backend.model.Designer;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class DesignerService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private DesignerMapper designerMapper;

    public String createDesigner(CreateDesignerRequest request) {
        String id = documentStore.create(designerMapper.toDocument(request));
        log.info("Created designer {}", id);
        return id;
    }

    public List<Designer> listDesigners() {
        return documentStore.list(Designer.class, DocumentFilter.matchAll(), LIST_LIMIT);
    }
}
