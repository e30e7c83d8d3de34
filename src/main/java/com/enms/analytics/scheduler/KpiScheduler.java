package com.enms.analytics.scheduler;

import com.enms.analytics.event.EnergyEventPublisher;
import com.enms.analytics.event.EventTopic;
import com.enms.analytics.performance.KpiService;
import com.enms.analytics.performance.KpiSummary;
import com.enms.analytics.persistence.SignificantEnergyUserEntity;
import com.enms.analytics.persistence.SignificantEnergyUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes the previous day's KPIs for each active SEU to dashboard subscribers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KpiScheduler {

    private final SignificantEnergyUserRepository seuRepository;
    private final KpiService kpiService;
    private final EnergyEventPublisher eventPublisher;
    private final Clock clock;

    @Scheduled(cron = "${kpi.publish.cron:0 30 0 * * *}")
    public void publishDailyKpis() {
        LocalDate day = LocalDate.now(clock).minusDays(1);
        LocalDateTime from = day.atStartOfDay();
        LocalDateTime to = from.plusDays(1);

        for (SignificantEnergyUserEntity seu : seuRepository.findByActiveTrueOrderByName()) {
            try {
                KpiSummary kpis = kpiService.calculate(seu.getEquipmentIds(), seu.getEnergySource(), from, to);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("seuName", seu.getName());
                data.put("date", day);
                data.put("kpis", kpis);
                eventPublisher.publish(EventTopic.METRIC_UPDATED, data);
            } catch (Exception e) {
                log.error("KPI calculation for {} on {} failed: {}", seu.getName(), day, e.getMessage());
            }
        }
    }
}
