package com.enms.analytics.performance;

import com.enms.analytics.config.PerformanceProperties;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Spoken summary built only from computed numbers. It never carries error text:
 * an analysis that cannot be completed fails before reaching this point.
 */
public class VoiceSummaryComposer {

    private final PerformanceProperties properties;

    public VoiceSummaryComposer(PerformanceProperties properties) {
        this.properties = properties;
    }

    public String compose(PerformanceAnalysis analysis, boolean today) {
        String unit = properties.unitLabelFor(analysis.getEnergySource());
        String when = today ? "today" : "on " + analysis.getDate();
        StringBuilder text = new StringBuilder();

        Double deviationPercent = analysis.getDeviationPercent();
        if (deviationPercent == null) {
            text.append(format("%s used %.1f %s %s. No baseline is available yet, so the deviation cannot be assessed.",
                    analysis.getSeuName(), analysis.getActualEnergy(), unit, when));
        } else if (Math.abs(deviationPercent) <= properties.getTolerancePercent()) {
            text.append(format("%s is performing as expected %s. Consumption is %.1f %s, which is within normal range.",
                    analysis.getSeuName(), when, analysis.getActualEnergy(), unit));
        } else {
            boolean over = deviationPercent > 0;
            text.append(format("%s used %.1f%% %s energy than expected %s. ",
                    analysis.getSeuName(), Math.abs(deviationPercent), over ? "more" : "less", when));
            text.append(format("Actual consumption was %.1f %s compared to a baseline of %.1f. ",
                    analysis.getActualEnergy(), unit, analysis.getBaselineEnergy()));
            text.append(format("This %s %s%.2f. ",
                    over ? "cost an extra" : "saved", properties.getCurrencySymbol(),
                    Math.abs(analysis.getDeviationCost())));
            text.append(analysis.getRootCause().getImpactDescription()).append('.');
        }

        if (analysis.getCriticalAnomalyCount() > 0) {
            text.append(format(" %d critical anomalies were detected.", analysis.getCriticalAnomalyCount()));
        }
        if (analysis.isProjection()) {
            text.append(format(" This is a full-day projection from %.1f hours of data, %.1f %s so far.",
                    analysis.getHoursElapsed(), analysis.getActualRaw(), unit));
        }
        return text.toString();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
