package com.enms.analytics.persistence;

import com.enms.analytics.aggregate.FeatureRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FeatureDefinitionRepository extends JpaRepository<FeatureDefinitionEntity, Long> {

    List<FeatureDefinitionEntity> findByEnergySourceAndActiveTrueOrderByFeatureName(String energySource);

    List<FeatureDefinitionEntity> findByEnergySourceAndRoleAndActiveTrueOrderByFeatureName(
            String energySource, FeatureRole role);

    Optional<FeatureDefinitionEntity> findByEnergySourceAndFeatureNameAndActiveTrue(
            String energySource, String featureName);
}
