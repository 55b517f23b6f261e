package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateDesignerRequest;
import com.designgrowth.backend.model.Designer;
import com.designgrowth.backend.service.CareerFramework;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;

@Component
public class DesignerMapper {

    public Designer toDocument(CreateDesignerRequest request) {
        return Designer.builder()
                .name(request.getName())
                .email(request.getEmail())
                .managerId(request.getManagerId())
                .currentLevel(StringUtils.hasText(request.getCurrentLevel())
                        ? request.getCurrentLevel()
                        : CareerFramework.DEFAULT_LEVEL)
                .guilds(request.getGuilds() != null ? request.getGuilds() : new ArrayList<>())
                .build();
    }
}
