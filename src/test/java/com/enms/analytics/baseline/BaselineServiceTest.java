package com.enms.analytics.baseline;

import com.enms.analytics.BaseIntegrationTest;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.dto.BaselineModelSummary;
import com.enms.analytics.dto.DeviationResult;
import com.enms.analytics.exception.InsufficientSamplesException;
import com.enms.analytics.exception.InvalidRequestException;
import com.enms.analytics.exception.MissingDriverDataException;
import com.enms.analytics.exception.ResourceNotFoundException;
import com.enms.analytics.exception.UnknownFeatureException;
import com.enms.analytics.persistence.BaselineModelEntity;
import com.enms.analytics.persistence.EnergyReadingEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BaselineService Tests")
class BaselineServiceTest extends BaseIntegrationTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 3, 1, 0, 0);
    private static final String PRESS = "press-1";

    @Autowired
    private BaselineService baselineService;

    @BeforeEach
    void setUp() {
        createEquipment(PRESS);
    }

    @Nested
    @DisplayName("Training")
    class TrainingTests {

        @Test
        @DisplayName("Explicit drivers fit a model that meets the quality threshold")
        void explicitFeatures() {
            seedHours(72, false);

            BaselineModelSummary summary = baselineService.train(request(List.of("production_count")));

            assertEquals(1, summary.getVersion());
            assertEquals(List.of("production_count"), summary.getFeatureNames());
            assertEquals(Resolution.HOURLY, summary.getResolution());
            assertEquals(72, summary.getSampleCount());
            assertEquals(QualityTier.MEETS_THRESHOLD, summary.getQualityTier());
            assertThat(summary.getCoefficients()[0]).isCloseTo(2.0, within(1e-6));
            assertThat(summary.getIntercept()).isCloseTo(20.0, within(1e-6));
            assertThat(summary.getRSquared()).isCloseTo(1.0, within(1e-9));
            assertFalse(summary.isAutoSelected());
        }

        @Test
        @DisplayName("Empty driver list selects drivers automatically")
        void autoSelection() {
            seedHours(72, false);

            BaselineModelSummary summary = baselineService.train(request(null));

            assertTrue(summary.isAutoSelected());
            assertThat(summary.getFeatureNames()).contains("production_count");
            assertThat(summary.getFeatureNames()).doesNotContain("pressure_bar", "avg_load_factor");
            assertThat(summary.getRSquared()).isGreaterThan(0.99);
        }

        @Test
        @DisplayName("Retraining stores a new version and keeps the old one")
        void versioning() {
            seedHours(72, false);

            baselineService.train(request(List.of("production_count")));
            baselineService.train(request(List.of("production_count", "outdoor_temp_c")));

            List<BaselineModelSummary> models = baselineService.listModels(TargetType.EQUIPMENT, PRESS);
            assertEquals(2, models.size());
            assertEquals(2, models.get(0).getVersion());

            BaselineModelEntity latest = baselineService.getModel(TargetType.EQUIPMENT, PRESS, "electricity", null);
            assertEquals(2, latest.getVersion());
            BaselineModelEntity first = baselineService.getModel(TargetType.EQUIPMENT, PRESS, "electricity", 1);
            assertEquals(List.of("production_count"), first.getFeatureNames());
        }

        @Test
        @DisplayName("Noisy relation is stored as low confidence and never used")
        void lowConfidence() {
            seedHours(72, true);

            BaselineModelSummary summary = baselineService.train(request(List.of("production_count")));

            assertEquals(QualityTier.LOW_CONFIDENCE, summary.getQualityTier());
            assertFalse(summary.isMeetsQualityThreshold());
            assertTrue(baselineService.findLatestUsable(TargetType.EQUIPMENT, PRESS, "electricity").isEmpty());
            assertThrows(ResourceNotFoundException.class,
                    () -> baselineService.getModel(TargetType.EQUIPMENT, PRESS, "electricity", null));
        }

        @Test
        @DisplayName("Too few complete rows at every resolution is reported with counts")
        void insufficientSamples() {
            seedHours(10, false);

            InsufficientSamplesException ex = assertThrows(InsufficientSamplesException.class,
                    () -> baselineService.train(request(List.of("production_count"))));
            assertEquals(10, ex.getSamples());
            assertEquals(30, ex.getRequired());
        }

        @Test
        @DisplayName("Explicit driver without data fails instead of being dropped")
        void missingDriver() {
            seedHours(72, false);

            MissingDriverDataException ex = assertThrows(MissingDriverDataException.class,
                    () -> baselineService.train(request(List.of("production_count", "pressure_bar"))));
            assertEquals("pressure_bar", ex.getFeatureName());
        }

        @Test
        @DisplayName("Driver registered for another energy source is unknown")
        void unknownFeature() {
            TrainingRequest request = request(List.of("avg_load_factor"));
            request.setEnergySource("natural_gas");

            assertThrows(UnknownFeatureException.class, () -> baselineService.train(request));
        }

        @Test
        @DisplayName("Unknown targets are not found")
        void unknownTarget() {
            TrainingRequest request = request(List.of("production_count"));
            request.setTargetId("press-99");

            assertThrows(ResourceNotFoundException.class, () -> baselineService.train(request));
        }

        @Test
        @DisplayName("SEU training pools its equipment units")
        void seuTarget() {
            createSeu("Presses", "electricity", PRESS);
            seedHours(72, false);

            TrainingRequest request = request(List.of("production_count"));
            request.setTargetType(TargetType.SEU);
            request.setTargetId("presses");

            BaselineModelSummary summary = baselineService.train(request);
            assertEquals(TargetType.SEU, summary.getTargetType());
            assertEquals(QualityTier.MEETS_THRESHOLD, summary.getQualityTier());
        }
    }

    @Nested
    @DisplayName("Prediction")
    class PredictionTests {

        private BaselineModelEntity model;

        @BeforeEach
        void trainModel() {
            seedHours(72, false);
            baselineService.train(request(List.of("production_count")));
            model = baselineService.getModel(TargetType.EQUIPMENT, PRESS, "electricity", null);
        }

        @Test
        @DisplayName("Predicts from named feature values")
        void predict() {
            assertThat(baselineService.predict(model, Map.of("production_count", 50.0)))
                    .isCloseTo(120.0, within(1e-6));
        }

        @Test
        @DisplayName("Missing feature value is rejected")
        void missingValue() {
            assertThrows(InvalidRequestException.class,
                    () -> baselineService.predict(model, Map.of("outdoor_temp_c", 5.0)));
        }

        @Test
        @DisplayName("Deviation is signed, positive for over-consumption")
        void deviation() {
            DeviationResult result = baselineService.deviation(model, 132.0, Map.of("production_count", 50.0));

            assertThat(result.getExpected()).isCloseTo(120.0, within(1e-6));
            assertThat(result.getDeviation()).isCloseTo(12.0, within(1e-6));
            assertThat(result.getDeviationPercent()).isCloseTo(10.0, within(1e-6));
            assertEquals(1, result.getModelVersion());
        }

        @Test
        @DisplayName("Zero expectation gives no percentage")
        void zeroExpectation() {
            assertNull(BaselineService.deviationPercent(10.0, 0.0));
            assertEquals(-50.0, BaselineService.deviationPercent(50.0, 100.0));
        }
    }

    /**
     * One reading per hour with consumption = 2 x production + 20, optionally buried in noise.
     */
    private void seedHours(int hours, boolean noisy) {
        List<EnergyReadingEntity> readings = new ArrayList<>();
        for (int h = 0; h < hours; h++) {
            double production = 10 + (h % 7) * 5;
            double consumption = 2 * production + 20;
            if (noisy) {
                consumption += (h % 3 == 0 ? 60 : -30) * ((h / 3) % 2 == 0 ? 1 : -1);
            }
            EnergyReadingEntity reading = reading(PRESS, START.plusHours(h), consumption);
            reading.setProductionCount(production);
            reading.setOutdoorTempC(4.0 + (h % 5));
            readings.add(reading);
        }
        readingRepository.saveAll(readings);
        refresh(Resolution.HOURLY, START, START.plusHours(hours));
        refresh(Resolution.DAILY, START, START.plusHours(hours));
    }

    private static TrainingRequest request(List<String> features) {
        return TrainingRequest.builder()
                .targetType(TargetType.EQUIPMENT)
                .targetId(PRESS)
                .energySource("electricity")
                .from(START)
                .to(START.plusDays(10))
                .features(features)
                .triggerReason("test")
                .build();
    }
}
