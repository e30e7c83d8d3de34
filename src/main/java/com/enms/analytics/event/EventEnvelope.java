package com.enms.analytics.event;

import java.time.Instant;

/**
 * JSON message pushed to live subscribers.
 */
public record EventEnvelope(String type, Object data, Instant timestamp) {
}
