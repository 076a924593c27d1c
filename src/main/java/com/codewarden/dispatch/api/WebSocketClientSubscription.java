package com.codewarden.dispatch.api;

import com.codewarden.core.events.ClientSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ClientSubscription} over a WebSocket session. Sends are serialised
 * by {@link ConcurrentWebSocketSessionDecorator} so acknowledgments and
 * broadcasts can be written from different threads.
 */
class WebSocketClientSubscription implements ClientSubscription {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientSubscription.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    WebSocketClientSubscription(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String message) throws IOException {
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", id(), e.getMessage());
        }
    }
}
