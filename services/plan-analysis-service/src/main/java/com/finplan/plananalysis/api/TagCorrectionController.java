package com.finplan.plananalysis.api;

import com.finplan.plananalysis.dto.CorrectedTermStats;
import com.finplan.plananalysis.dto.LearnCorrectionRequest;
import com.finplan.plananalysis.dto.TagCorrectionResponse;
import com.finplan.plananalysis.entity.TagCorrection;
import com.finplan.plananalysis.exception.InvalidCorrectionException;
import com.finplan.plananalysis.model.ItemTag;
import com.finplan.plananalysis.service.CorrectionLearningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/plan-analysis/corrections")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tag Corrections", description = "User corrections that train the tag predictor")
public class TagCorrectionController {

    private final CorrectionLearningService correctionLearningService;

    @PostMapping
    @Operation(summary = "Save correction", description = "Stores a tag correction and applies it to future predictions")
    public ResponseEntity<TagCorrectionResponse> saveCorrection(
            @Valid @RequestBody LearnCorrectionRequest request,
            @RequestHeader("X-User-Id") UUID userId) {

        ItemTag corrected = tag(request.getCorrectedTag());
        TagCorrection saved = request.getPredictedTag() == null
            ? correctionLearningService.learnFromCorrection(userId, request.getTerm(), corrected,
                request.getSourceFileId())
            : correctionLearningService.saveCorrection(userId, request.getTerm(), predictedTag(request.getPredictedTag()),
                corrected, request.getSourceFileId());

        return ResponseEntity.status(HttpStatus.CREATED).body(TagCorrectionResponse.from(saved));
    }

    @GetMapping
    @Operation(summary = "List corrections", description = "The caller's corrections, most recent first")
    public ResponseEntity<List<TagCorrectionResponse>> listCorrections(@RequestHeader("X-User-Id") UUID userId) {
        return ResponseEntity.ok(correctionLearningService.listCorrections(userId).stream()
            .map(TagCorrectionResponse::from)
            .toList());
    }

    @DeleteMapping
    @Operation(summary = "Delete correction", description = "Forgets the caller's correction of a term")
    public ResponseEntity<Void> deleteCorrection(@RequestParam String term,
                                                 @RequestHeader("X-User-Id") UUID userId) {
        correctionLearningService.deleteCorrection(userId, term);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/most-corrected")
    @Operation(summary = "Most corrected terms", description = "Terms corrected most often across all users")
    public ResponseEntity<List<CorrectedTermStats>> mostCorrectedTerms(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(correctionLearningService.mostCorrectedTerms(limit).stream()
            .map(row -> new CorrectedTermStats(row.getTerm(), row.getCorrections()))
            .toList());
    }

    private static ItemTag predictedTag(String code) {
        return ItemTag.fromCode(code).orElseThrow(() -> InvalidCorrectionException.unknownTag(code));
    }

    private static ItemTag tag(String code) {
        return ItemTag.fromCode(code)
            .filter(tag -> tag != ItemTag.UNKNOWN)
            .orElseThrow(() -> InvalidCorrectionException.unknownTag(code));
    }
}
