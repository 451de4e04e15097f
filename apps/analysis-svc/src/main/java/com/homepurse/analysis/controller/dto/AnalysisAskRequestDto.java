package com.homepurse.analysis.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalysisAskRequestDto(
        @NotBlank @Size(max = 2000) String question
) {
}
