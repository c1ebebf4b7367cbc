package com.finplan.plananalysis.repository;

import com.finplan.plananalysis.entity.TagCorrection;
import com.finplan.plananalysis.model.ModelType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TagCorrectionRepository extends JpaRepository<TagCorrection, UUID> {

    List<TagCorrection> findByUserIdAndModelTypeOrderByUpdatedAtAscIdAsc(UUID userId, ModelType modelType);

    List<TagCorrection> findByUserIdOrderByUpdatedAtDesc(UUID userId);

    long deleteByUserIdAndTermAndModelType(UUID userId, String term, ModelType modelType);

    @Query("SELECT c.term AS term, COUNT(c) AS corrections FROM TagCorrection c " +
           "WHERE c.modelType = :modelType GROUP BY c.term ORDER BY COUNT(c) DESC, c.term ASC")
    List<TermCorrectionCount> findMostCorrectedTerms(@Param("modelType") ModelType modelType, Pageable pageable);

    @Query("SELECT c.term AS term, c.correctedTag AS correctedTag, COUNT(DISTINCT c.userId) AS users " +
           "FROM TagCorrection c WHERE c.modelType = :modelType " +
           "GROUP BY c.term, c.correctedTag HAVING COUNT(DISTINCT c.userId) >= :minUsers " +
           "ORDER BY c.term ASC, COUNT(DISTINCT c.userId) DESC")
    List<TermConsensus> findConsensusTerms(@Param("modelType") ModelType modelType, @Param("minUsers") long minUsers);

    interface TermCorrectionCount {
        String getTerm();

        Long getCorrections();
    }

    interface TermConsensus {
        String getTerm();

        String getCorrectedTag();

        Long getUsers();
    }
}
