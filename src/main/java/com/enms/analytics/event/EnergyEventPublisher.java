package com.enms.analytics.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Fire-and-forget publication onto the in-process bus. Never throws to the caller:
 * a failed publish is logged and dropped.
 */
@Component
@Slf4j
public class EnergyEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final TaskExecutor eventExecutor;
    private final Clock clock;

    public EnergyEventPublisher(ApplicationEventPublisher applicationEventPublisher,
                                @Qualifier("eventExecutor") TaskExecutor eventExecutor,
                                Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.eventExecutor = eventExecutor;
        this.clock = clock;
    }

    public void publish(EventTopic topic, Object data) {
        try {
            EnergyEvent event = new EnergyEvent(topic,
                    new EventEnvelope(topic.getWireName(), data, Instant.now(clock)));
            eventExecutor.execute(() -> dispatch(event));
        } catch (Exception e) {
            log.warn("Failed to publish {} event: {}", topic.getWireName(), e.getMessage());
        }
    }

    private void dispatch(EnergyEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (Exception e) {
            log.warn("Event listener failed for {}: {}", event.topic().getWireName(), e.getMessage());
        }
    }
}
