package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * Log entry of a notification. Nothing delivers these; they are only recorded.
 */
@Document(collection = "notification")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String userId;
    private String kind; // review_reminder | goal_due | guild_event
    private String message;
    private List<String> sentVia; // e.g. ["email", "slack"]
}
