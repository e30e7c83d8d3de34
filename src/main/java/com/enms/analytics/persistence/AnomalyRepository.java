package com.enms.analytics.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnomalyRepository extends JpaRepository<AnomalyEntity, Long>,
        JpaSpecificationExecutor<AnomalyEntity> {

    Optional<AnomalyEntity> findByEquipmentIdAndDetectedAtAndMetric(
            String equipmentId, LocalDateTime detectedAt, String metric);

    @Query("SELECT a FROM AnomalyEntity a WHERE a.equipmentId IN :equipmentIds " +
            "AND a.detectedAt >= :from AND a.detectedAt < :to ORDER BY a.detectedAt ASC")
    List<AnomalyEntity> findForEquipmentBetween(@Param("equipmentIds") Collection<String> equipmentIds,
                                                @Param("from") LocalDateTime from,
                                                @Param("to") LocalDateTime to);

    List<AnomalyEntity> findByResolvedFalseOrderByDetectedAtDesc();
}
