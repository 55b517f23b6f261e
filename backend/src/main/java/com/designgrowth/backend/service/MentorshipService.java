package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateMentorshipRequest;
import com.designgrowth.backend.mapper.MentorshipMapper;
import com.designgrowth.backend.model.Mentorship;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class MentorshipService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private MentorshipMapper mentorshipMapper;

    public String createMentorship(CreateMentorshipRequest request) {
        String id = documentStore.create(mentorshipMapper.toDocument(request));
        log.info("Created mentorship {}", id);
        return id;
    }

    public List<Mentorship> listMentorships(String mentorId, String menteeId) {
        DocumentFilter filter = DocumentFilter.matchAll()
                .equalTo("mentorId", mentorId)
                .equalTo("menteeId", menteeId);
        return documentStore.list(Mentorship.class, filter, LIST_LIMIT);
    }
}
