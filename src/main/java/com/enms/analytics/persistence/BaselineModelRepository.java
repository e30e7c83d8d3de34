package com.enms.analytics.persistence;

import com.enms.analytics.baseline.QualityTier;
import com.enms.analytics.baseline.TargetType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface BaselineModelRepository extends JpaRepository<BaselineModelEntity, Long> {

    Optional<BaselineModelEntity> findTopByTargetTypeAndTargetIdAndEnergySourceOrderByVersionDesc(
            TargetType targetType, String targetId, String energySource);

    Optional<BaselineModelEntity> findTopByTargetTypeAndTargetIdAndEnergySourceAndQualityTierInOrderByVersionDesc(
            TargetType targetType, String targetId, String energySource, Collection<QualityTier> tiers);

    Optional<BaselineModelEntity> findByTargetTypeAndTargetIdAndEnergySourceAndVersion(
            TargetType targetType, String targetId, String energySource, int version);

    List<BaselineModelEntity> findByTargetTypeAndTargetIdOrderByEnergySourceAscVersionDesc(
            TargetType targetType, String targetId);

    @Query("SELECT COALESCE(MAX(m.version), 0) FROM BaselineModelEntity m " +
            "WHERE m.targetType = :targetType AND m.targetId = :targetId AND m.energySource = :energySource")
    int findMaxVersion(@Param("targetType") TargetType targetType,
                       @Param("targetId") String targetId,
                       @Param("energySource") String energySource);
}
