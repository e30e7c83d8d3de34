package com.enms.analytics.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface EnergyReadingRepository extends JpaRepository<EnergyReadingEntity, Long> {

    @Query("SELECT r FROM EnergyReadingEntity r WHERE r.time >= :from AND r.time < :to ORDER BY r.time ASC")
    List<EnergyReadingEntity> findReadingsBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Query("SELECT COALESCE(SUM(r.value), 0) FROM EnergyReadingEntity r " +
            "WHERE r.equipmentId IN :equipmentIds AND r.energyType = :energyType " +
            "AND r.time >= :from AND r.time < :to")
    double sumValue(@Param("equipmentIds") Collection<String> equipmentIds,
                    @Param("energyType") String energyType,
                    @Param("from") LocalDateTime from,
                    @Param("to") LocalDateTime to);

    @Query("SELECT COUNT(r) FROM EnergyReadingEntity r " +
            "WHERE r.equipmentId IN :equipmentIds AND r.energyType = :energyType " +
            "AND r.time >= :from AND r.time < :to")
    long countReadings(@Param("equipmentIds") Collection<String> equipmentIds,
                       @Param("energyType") String energyType,
                       @Param("from") LocalDateTime from,
                       @Param("to") LocalDateTime to);

    @Query("SELECT DISTINCT r.energyType FROM EnergyReadingEntity r WHERE r.equipmentId = :equipmentId")
    List<String> findEnergyTypes(@Param("equipmentId") String equipmentId);
}
