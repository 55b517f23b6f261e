package com.designgrowth.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Document(collection = "guild")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Guild implements GrowthDocument {
    @Id
    @JsonProperty("_id")
    private String id;
    private String name;
    private String description;
    private List<CalendarEntry> calendar;
}
