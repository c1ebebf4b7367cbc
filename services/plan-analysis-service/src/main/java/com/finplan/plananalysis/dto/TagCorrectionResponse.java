package com.finplan.plananalysis.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.finplan.plananalysis.entity.TagCorrection;
import com.finplan.plananalysis.model.ModelType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TagCorrectionResponse {

    private UUID id;
    private String term;
    private String predictedTag;
    private String correctedTag;
    private ModelType modelType;
    private String sourceFileId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static TagCorrectionResponse from(TagCorrection correction) {
        return TagCorrectionResponse.builder()
            .id(correction.getId())
            .term(correction.getTerm())
            .predictedTag(correction.getPredictedTag())
            .correctedTag(correction.getCorrectedTag())
            .modelType(correction.getModelType())
            .sourceFileId(correction.getSourceFileId())
            .createdAt(correction.getCreatedAt())
            .updatedAt(correction.getUpdatedAt())
            .build();
    }
}
