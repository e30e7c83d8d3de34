package com.enms.analytics.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;

/**
 * Live subscriber backed by a Server-Sent Events stream; envelopes are written as JSON.
 */
@Slf4j
public class SseLiveSubscriber implements LiveSubscriber {

    private final String id;
    private final SseEmitter emitter;

    public SseLiveSubscriber(SseEmitter emitter) {
        this.id = UUID.randomUUID().toString();
        this.emitter = emitter;
    }

    @Override
    public String getId() {
        return id;
    }

    public SseEmitter getEmitter() {
        return emitter;
    }

    @Override
    public void send(EventEnvelope envelope) throws IOException {
        emitter.send(SseEmitter.event()
                .name(envelope.type())
                .data(envelope, MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.trace("Emitter {} already completed", id);
        }
    }
}
