package com.finplan.plananalysis.entity;

import com.finplan.plananalysis.model.ModelType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A user's correction of a predicted tag. One row per (user, term, model type);
 * saving the same term again overwrites the previous correction.
 *
 * <p>Tags are stored as their short codes (B, R, S, IN, D) and resolved when the
 * correction is replayed, so unknown codes surface there instead of failing the load.
 */
@Entity
@Table(name = "user_tag_corrections",
    uniqueConstraints = @UniqueConstraint(name = "uk_user_tag_corrections_user_term_model",
        columnNames = {"user_id", "term", "model_type"}),
    indexes = @Index(name = "idx_user_tag_corrections_term", columnList = "term"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagCorrection {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /** Normalized (trimmed, lower-cased) category text. */
    @Column(name = "term", nullable = false, length = 255)
    private String term;

    @Column(name = "predicted_tag", length = 8)
    private String predictedTag;

    @Column(name = "corrected_tag", nullable = false, length = 8)
    private String correctedTag;

    @Enumerated(EnumType.STRING)
    @Column(name = "model_type", nullable = false, length = 20)
    private ModelType modelType;

    @Column(name = "source_file_id")
    private String sourceFileId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
