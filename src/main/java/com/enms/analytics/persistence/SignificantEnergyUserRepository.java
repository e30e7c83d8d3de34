package com.enms.analytics.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SignificantEnergyUserRepository extends JpaRepository<SignificantEnergyUserEntity, Long> {

    Optional<SignificantEnergyUserEntity> findByNameIgnoreCase(String name);

    List<SignificantEnergyUserEntity> findByActiveTrueOrderByName();
}
