package com.enms.analytics.performance;

import com.enms.analytics.config.PerformanceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("PerformanceRules Tests")
class PerformanceRulesTest {

    private final PerformanceRules rules = new PerformanceRules(new PerformanceProperties());

    @Nested
    @DisplayName("Efficiency score")
    class EfficiencyTests {

        @Test
        @DisplayName("Bands by deviation magnitude regardless of sign")
        void bands() {
            assertEquals(1.0, PerformanceRules.efficiencyScore(0.0));
            assertEquals(1.0, PerformanceRules.efficiencyScore(-5.0));
            assertEquals(0.8, PerformanceRules.efficiencyScore(7.9));
            assertEquals(0.8, PerformanceRules.efficiencyScore(-15.0));
            assertEquals(0.6, PerformanceRules.efficiencyScore(22.0));
            assertEquals(0.4, PerformanceRules.efficiencyScore(-45.0));
        }
    }

    @Nested
    @DisplayName("Compliance status")
    class ComplianceTests {

        @Test
        @DisplayName("Favorable deviation beyond tolerance is excellent")
        void excellent() {
            assertEquals(ComplianceStatus.EXCELLENT, rules.complianceStatus(-12.0, 0));
        }

        @Test
        @DisplayName("Within tolerance is on target")
        void onTarget() {
            assertEquals(ComplianceStatus.ON_TARGET, rules.complianceStatus(4.9, 0));
            assertEquals(ComplianceStatus.ON_TARGET, rules.complianceStatus(-5.0, 5));
        }

        @Test
        @DisplayName("Moderate over-consumption requires attention")
        void requiresAttention() {
            assertEquals(ComplianceStatus.REQUIRES_ATTENTION, rules.complianceStatus(7.9, 0));
            assertEquals(ComplianceStatus.REQUIRES_ATTENTION, rules.complianceStatus(7.9, 2));
        }

        @Test
        @DisplayName("Severe or sustained over-consumption is non-compliant")
        void nonCompliant() {
            assertEquals(ComplianceStatus.NON_COMPLIANT, rules.complianceStatus(15.1, 0));
            assertEquals(ComplianceStatus.NON_COMPLIANT, rules.complianceStatus(7.9, 3));
        }

        @Test
        @DisplayName("Unknown deviation is undetermined")
        void undetermined() {
            assertEquals(ComplianceStatus.UNDETERMINED, rules.complianceStatus(null, 4));
        }
    }

    @Nested
    @DisplayName("Root cause")
    class RootCauseTests {

        @Test
        @DisplayName("Classifies by deviation bands")
        void classification() {
            assertEquals(RootCause.HIGH_DEMAND, rules.rootCause(25.0, 24, 1.0, 0).getPrimaryFactor());
            assertEquals(RootCause.REDUCED_LOAD, rules.rootCause(-25.0, 24, 1.0, 0).getPrimaryFactor());
            assertEquals(RootCause.NORMAL_OPERATION, rules.rootCause(3.0, 24, 1.0, 0).getPrimaryFactor());
            assertEquals(RootCause.PROCESS_CHANGE, rules.rootCause(-9.0, 24, 1.0, 0).getPrimaryFactor());
        }

        @Test
        @DisplayName("Confidence drops for partial days and weaker baselines")
        void confidence() {
            double fullDay = rules.rootCause(10.0, 24, 1.0, 0).getConfidence();
            double partialDay = rules.rootCause(10.0, 12, 1.0, 0).getConfidence();
            double acceptableModel = rules.rootCause(10.0, 24, 0.9, 0).getConfidence();

            assertThat(fullDay).isCloseTo(0.7, within(1e-9));
            assertThat(partialDay).isCloseTo(0.7 * 0.75, within(1e-9));
            assertThat(acceptableModel).isCloseTo(0.63, within(1e-9));
        }

        @Test
        @DisplayName("No baseline gives unknown cause with zero confidence")
        void unknown() {
            RootCauseAnalysis analysis = rules.rootCause(null, 24, 1.0, 2);

            assertEquals(RootCause.UNKNOWN, analysis.getPrimaryFactor());
            assertEquals(0.0, analysis.getConfidence());
        }

        @Test
        @DisplayName("Critical anomalies are listed as a contributing factor")
        void anomaliesContribute() {
            assertThat(rules.rootCause(25.0, 24, 1.0, 2).getContributingFactors())
                    .contains("2 critical anomalies detected");
        }
    }

    @Nested
    @DisplayName("Recommendations")
    class RecommendationTests {

        @Test
        @DisplayName("Severe deviation yields two high-priority recommendations")
        void severe() {
            List<Recommendation> result = rules.recommendations(20.0, 200.0, 0.15, 0);

            assertEquals(2, result.size());
            assertThat(result).allSatisfy(r -> assertEquals(RecommendationPriority.HIGH, r.getPriority()));
            assertEquals(60.0, result.get(0).getEstimatedSavings(), 1e-9);
            assertEquals(9.0, result.get(0).getEstimatedSavingsCost(), 1e-9);
            assertEquals(7, result.get(1).getExpectedPaybackDays());
        }

        @Test
        @DisplayName("Actionable deviation yields one medium-priority recommendation")
        void actionable() {
            List<Recommendation> result = rules.recommendations(8.0, 80.0, 0.15, 0);

            assertEquals(1, result.size());
            assertEquals(RecommendationPriority.MEDIUM, result.get(0).getPriority());
            assertEquals(40.0, result.get(0).getEstimatedSavings(), 1e-9);
        }

        @Test
        @DisplayName("Critical anomalies add a critical-priority recommendation")
        void criticalAnomalies() {
            List<Recommendation> result = rules.recommendations(8.0, 80.0, 0.15, 1);

            assertEquals(2, result.size());
            assertEquals(RecommendationPriority.CRITICAL, result.get(1).getPriority());
        }

        @Test
        @DisplayName("Favorable or small deviations produce nothing")
        void none() {
            assertThat(rules.recommendations(-30.0, -300.0, 0.15, 0)).isEmpty();
            assertThat(rules.recommendations(4.0, 40.0, 0.15, 0)).isEmpty();
            assertThat(rules.recommendations(null, null, 0.15, 3)).isEmpty();
        }
    }
}
