package com.homepurse.analysis.audit;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAnalysisQueryRepository extends JpaRepository<AnalysisQueryEntity, UUID> {
    Optional<AnalysisQueryEntity> findByIdAndHouseholdId(UUID id, UUID householdId);
}
