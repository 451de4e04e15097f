package com.homepurse.analysis.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAnalysisAttemptRepository extends JpaRepository<AnalysisAttemptEntity, UUID> {
    List<AnalysisAttemptEntity> findByAnalysisQueryIdOrderByAttemptNumberAsc(UUID analysisQueryId);
}
