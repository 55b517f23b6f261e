package com.designgrowth.backend.service;

import com.designgrowth.backend.dto.request.CreateGuildRequest;
import com.designgrowth.backend.mapper.GuildMapper;
import com.designgrowth.backend.model.Guild;
import com.designgrowth.backend.repository.DocumentFilter;
import com.designgrowth.backend.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class GuildService {

    public static final int LIST_LIMIT = 200;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private GuildMapper guildMapper;

    public String createGuild(CreateGuildRequest request) {
        String id = documentStore.create(guildMapper.toDocument(request));
        log.info("Created guild {}", id);
        return id;
    }

    public List<Guild> listGuilds() {
        return documentStore.list(Guild.class, DocumentFilter.matchAll(), LIST_LIMIT);
    }
}
