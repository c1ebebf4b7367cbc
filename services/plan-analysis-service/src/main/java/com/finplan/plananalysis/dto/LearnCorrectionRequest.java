package com.finplan.plananalysis.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's correction of a predicted tag. Tags are short codes (B, R, S, IN, D).
 * When {@code predictedTag} is omitted the current prediction is recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearnCorrectionRequest {

    @NotBlank(message = "Term is required")
    @Size(max = 255, message = "Term must not exceed 255 characters")
    private String term;

    @NotBlank(message = "Corrected tag is required")
    private String correctedTag;

    private String predictedTag;

    @Size(max = 255)
    private String sourceFileId;
}
