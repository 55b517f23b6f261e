package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateGoalRequest;
import com.designgrowth.backend.model.Goal;
import com.designgrowth.backend.utils.IsoDates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Optional;

@Component
@Slf4j
public class GoalMapper {

    public static final String DEFAULT_STATUS = "not_started";
    public static final int DEFAULT_PROGRESS = 0;

    public Goal toDocument(CreateGoalRequest request) {
        return Goal.builder()
                .designerId(request.getDesignerId())
                .title(request.getTitle())
                .description(request.getDescription())
                .competencyKey(request.getCompetencyKey())
                .targetDate(resolveTargetDate(request.getTargetDate()))
                .status(StringUtils.hasText(request.getStatus()) ? request.getStatus() : DEFAULT_STATUS)
                .progress(request.getProgress() != null ? request.getProgress() : DEFAULT_PROGRESS)
                .build();
    }

    /**
     * A parseable ISO value becomes a timestamp; anything else is stored exactly as the client sent it.
     */
    Object resolveTargetDate(String raw) {
        if (!StringUtils.hasText(raw)) {
            return raw;
        }
        Optional<Instant> parsed = IsoDates.parse(raw);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        log.debug("Keeping unparseable target_date '{}' as text", raw);
        return raw;
    }
}
