package com.enms.analytics.anomaly;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("AnomalyDetector Tests")
class AnomalyDetectorTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 3, 10, 0, 0);
    private static final SeverityThresholds THRESHOLDS = new SeverityThresholds(2.0, 3.0, 15.0, 30.0);

    private final AnomalyDetector detector = new AnomalyDetector(24, 6);

    @Nested
    @DisplayName("Statistical check")
    class StatisticalTests {

        @Test
        @DisplayName("Should flag a spike far outside the rolling window as critical")
        void shouldFlagSpike() {
            List<SeriesPoint> series = alternating(30, 100.0, 2.0);
            series.set(28, new SeriesPoint(START.plusHours(28), 300.0, null));

            List<AnomalyFinding> findings = detector.detectStatistical(series, START.plusHours(24), THRESHOLDS);

            assertEquals(1, findings.size());
            AnomalyFinding finding = findings.get(0);
            assertEquals(START.plusHours(28), finding.detectedAt());
            assertEquals(Severity.CRITICAL, finding.severity());
            assertEquals(AnomalyType.SPIKE, finding.type());
            assertEquals(DetectionMethod.STATISTICAL, finding.method());
            assertThat(finding.zScore()).isGreaterThan(3.0);
            assertThat(finding.expectedValue()).isCloseTo(100.0, within(0.5));
        }

        @Test
        @DisplayName("Should report a moderate drop as a warning")
        void shouldReportWarningDrop() {
            List<SeriesPoint> series = alternating(30, 100.0, 2.0);
            // Roughly 2.5 standard deviations below the mean
            series.set(27, new SeriesPoint(START.plusHours(27), 94.9, null));

            List<AnomalyFinding> findings = detector.detectStatistical(series, START.plusHours(24), THRESHOLDS);

            assertEquals(1, findings.size());
            assertEquals(Severity.WARNING, findings.get(0).severity());
            assertEquals(AnomalyType.DROP, findings.get(0).type());
        }

        @Test
        @DisplayName("Points before the evaluation start only seed the window")
        void seedPointsAreNotEvaluated() {
            List<SeriesPoint> series = alternating(30, 100.0, 2.0);
            series.set(10, new SeriesPoint(START.plusHours(10), 500.0, null));

            List<AnomalyFinding> findings = detector.detectStatistical(series, START.plusHours(24), THRESHOLDS);

            assertThat(findings).allSatisfy(f -> assertThat(f.detectedAt()).isAfterOrEqualTo(START.plusHours(24)));
        }

        @Test
        @DisplayName("Should not judge points before the minimum window is filled")
        void minimumWindow() {
            List<SeriesPoint> series = alternating(5, 100.0, 2.0);
            series.add(new SeriesPoint(START.plusHours(5), 900.0, null));

            assertThat(detector.detectStatistical(series, START, THRESHOLDS)).isEmpty();
        }

        @Test
        @DisplayName("A perfectly flat window produces no findings")
        void flatWindowIsSkipped() {
            List<SeriesPoint> series = alternating(30, 100.0, 0.0);
            series.set(29, new SeriesPoint(START.plusHours(29), 150.0, null));

            assertThat(detector.detectStatistical(series, START, THRESHOLDS)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Model deviation check")
    class ModelDeviationTests {

        @Test
        @DisplayName("Should grade deviation percentage against the thresholds")
        void shouldGradeDeviation() {
            List<SeriesPoint> series = List.of(
                    new SeriesPoint(START, 105.0, 100.0),
                    new SeriesPoint(START.plusHours(1), 120.0, 100.0),
                    new SeriesPoint(START.plusHours(2), 60.0, 100.0));

            List<AnomalyFinding> findings = detector.detectModelDeviation(series, START, THRESHOLDS);

            assertEquals(2, findings.size());
            assertEquals(Severity.WARNING, findings.get(0).severity());
            assertEquals(20.0, findings.get(0).deviationPercent(), 1e-9);
            assertEquals(Severity.CRITICAL, findings.get(1).severity());
            assertEquals(AnomalyType.DROP, findings.get(1).type());
            assertNull(findings.get(1).zScore());
        }

        @Test
        @DisplayName("Points without a positive expectation are skipped")
        void skipsMissingExpectation() {
            List<SeriesPoint> series = List.of(
                    new SeriesPoint(START, 500.0, null),
                    new SeriesPoint(START.plusHours(1), 500.0, 0.0));

            assertThat(detector.detectModelDeviation(series, START, THRESHOLDS)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("Abrupt changes are spikes or drops, gradual same-signed ones drift")
        void classify() {
            assertEquals(AnomalyType.SPIKE, AnomalyDetector.classify(50.0, 1.0));
            assertEquals(AnomalyType.DROP, AnomalyDetector.classify(-50.0, null));
            assertEquals(AnomalyType.DRIFT, AnomalyDetector.classify(50.0, 45.0));
            assertEquals(AnomalyType.SPIKE, AnomalyDetector.classify(50.0, -40.0));
            assertEquals(AnomalyType.UNKNOWN, AnomalyDetector.classify(0.0, 10.0));
        }
    }

    @Test
    @DisplayName("Should reject a minimum window larger than the rolling window")
    void rejectsInvalidWindows() {
        assertThrows(IllegalArgumentException.class, () -> new AnomalyDetector(4, 6));
        assertThrows(IllegalArgumentException.class, () -> new AnomalyDetector(24, 1));
    }

    @Test
    @DisplayName("Thresholds must be ordered")
    void rejectsUnorderedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new SeverityThresholds(3.0, 2.0, 15.0, 30.0));
    }

    private static List<SeriesPoint> alternating(int count, double level, double amplitude) {
        List<SeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double value = level + (i % 2 == 0 ? amplitude : -amplitude);
            series.add(new SeriesPoint(START.plusHours(i), value, null));
        }
        return series;
    }
}
