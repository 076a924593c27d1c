package com.codewarden.core.events;

import java.io.IOException;

/**
 * A connected consumer of broadcasts, e.g. one WebSocket session.
 */
public interface ClientSubscription {

    String id();

    boolean isOpen();

    /**
     * Sends one serialized message. Implementations must tolerate concurrent callers.
     */
    void send(String message) throws IOException;

    void close();
}
