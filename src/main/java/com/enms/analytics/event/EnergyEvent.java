package com.enms.analytics.event;

/**
 * Application event carrying one envelope through the in-process bus.
 */
public record EnergyEvent(EventTopic topic, EventEnvelope envelope) {
}
