package com.enms.analytics.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EquipmentUnitRepository extends JpaRepository<EquipmentUnitEntity, String> {

    List<EquipmentUnitEntity> findByActiveTrueOrderById();
}
