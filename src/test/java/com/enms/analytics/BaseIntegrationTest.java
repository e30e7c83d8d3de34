package com.enms.analytics;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.persistence.AnomalyRepository;
import com.enms.analytics.persistence.BaselineModelRepository;
import com.enms.analytics.persistence.EnergyReadingEntity;
import com.enms.analytics.persistence.EnergyReadingRepository;
import com.enms.analytics.persistence.EquipmentCategory;
import com.enms.analytics.persistence.EquipmentUnitEntity;
import com.enms.analytics.persistence.EquipmentUnitRepository;
import com.enms.analytics.persistence.FeatureDefinitionRepository;
import com.enms.analytics.persistence.SignificantEnergyUserEntity;
import com.enms.analytics.persistence.SignificantEnergyUserRepository;
import com.enms.analytics.persistence.TrainingJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import javax.sql.DataSource;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for integration tests.
 * Uses H2 in-memory database in PostgreSQL mode, the test profile and a pinned clock.
 * Every test starts from an empty store with the feature registry seeded.
 */
@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(locations = "classpath:application-test.properties")
@Import(BaseIntegrationTest.TestClockConfig.class)
public abstract class BaseIntegrationTest {

    /** Wednesday 2025-03-12 13:18 UTC. */
    protected static final Instant NOW = Instant.parse("2025-03-12T13:18:00Z");

    private static final List<String> ROLLUP_TABLES = List.of(
            "energy_readings_1m", "energy_readings_15m", "energy_readings_1h", "energy_readings_1d");

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected AggregateStore aggregateStore;

    @Autowired
    protected EnergyReadingRepository readingRepository;

    @Autowired
    protected EquipmentUnitRepository equipmentRepository;

    @Autowired
    protected SignificantEnergyUserRepository seuRepository;

    @Autowired
    private FeatureDefinitionRepository featureRepository;

    @Autowired
    private AnomalyRepository anomalyRepository;

    @Autowired
    private BaselineModelRepository modelRepository;

    @Autowired
    private TrainingJobRepository jobRepository;

    @Autowired
    private DataSource dataSource;

    @BeforeEach
    void resetStore() {
        clock.setInstant(NOW);

        anomalyRepository.deleteAll();
        modelRepository.deleteAll();
        jobRepository.deleteAll();
        seuRepository.deleteAll();
        equipmentRepository.deleteAll();
        readingRepository.deleteAll();
        featureRepository.deleteAll();
        ROLLUP_TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));

        new ResourceDatabasePopulator(new ClassPathResource("db/feature-definitions.sql")).execute(dataSource);
    }

    protected EquipmentUnitEntity createEquipment(String id) {
        return equipmentRepository.save(EquipmentUnitEntity.builder()
                .id(id)
                .name(id)
                .category(EquipmentCategory.COMPRESSOR)
                .ratedCapacityKw(75.0)
                .active(true)
                .build());
    }

    protected SignificantEnergyUserEntity createSeu(String name, String energySource, String... equipmentIds) {
        for (String id : equipmentIds) {
            if (!equipmentRepository.existsById(id)) {
                createEquipment(id);
            }
        }
        return seuRepository.save(SignificantEnergyUserEntity.builder()
                .name(name)
                .energySource(energySource)
                .equipmentIds(new ArrayList<>(List.of(equipmentIds)))
                .active(true)
                .build());
    }

    protected EnergyReadingEntity reading(String equipmentId, LocalDateTime time, double value) {
        return EnergyReadingEntity.builder()
                .equipmentId(equipmentId)
                .energyType("electricity")
                .time(time)
                .value(value)
                .build();
    }

    protected void refresh(Resolution resolution, LocalDateTime from, LocalDateTime to) {
        aggregateStore.refresh(resolution, from, to);
    }

    @TestConfiguration
    static class TestClockConfig {

        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(NOW);
        }
    }
}
