package com.designgrowth.backend.dto.request;

import com.designgrowth.backend.model.CalendarEntry;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateGuildRequest {
    @NotBlank(message = "Name is required.")
    private String name;

    private String description;
    private List<CalendarEntry> calendar;
}
