package com.designgrowth.backend.dto;

import com.designgrowth.backend.model.CareerLevel;
import com.designgrowth.backend.model.Competency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReferenceDataDTO {
    private List<Competency> competencies;
    private List<CareerLevel> careerLevels;
}
