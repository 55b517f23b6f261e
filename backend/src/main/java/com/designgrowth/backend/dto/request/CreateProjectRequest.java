package com.designgrowth.backend.dto.request;

import com.designgrowth.backend.model.ProjectStage;
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
public class CreateProjectRequest {
    @NotBlank(message = "Name is required.")
    private String name;

    private String description;
    private String managerId;
    private List<String> designers;
    private List<ProjectStage> stages;
}
