package com.enms.analytics.event;

import java.io.IOException;

/**
 * One live connection. A failed send marks the subscriber as gone.
 */
public interface LiveSubscriber {

    String getId();

    void send(EventEnvelope envelope) throws IOException;

    void close();
}
