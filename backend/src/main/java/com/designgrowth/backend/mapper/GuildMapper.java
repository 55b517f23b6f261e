package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateGuildRequest;
import com.designgrowth.backend.model.Guild;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

@Component
public class GuildMapper {

    public Guild toDocument(CreateGuildRequest request) {
        return Guild.builder()
                .name(request.getName())
                .description(request.getDescription())
                .calendar(request.getCalendar() != null ? request.getCalendar() : new ArrayList<>())
                .build();
    }
}
