package com.codewarden.dispatch.api;

import com.codewarden.core.events.BroadcastChannel;
import com.codewarden.core.logging.MdcContext;
import com.codewarden.core.realtime.ControlAck;
import com.codewarden.core.realtime.ControlMessage;
import com.codewarden.core.realtime.RealtimePipeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Control channel: each connection is subscribed to realtime broadcasts and
 * may send watch, unwatch and analyze_file requests. Every request gets
 * exactly one acknowledgment; a bad message is answered with an error and
 * never closes the connection.
 */
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

    private final RealtimePipeline pipeline;
    private final BroadcastChannel broadcastChannel;
    private final ObjectMapper objectMapper;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    private record Connection(WebSocketClientSubscription client, BroadcastChannel.Subscription subscription) {}

    public RealtimeWebSocketHandler(RealtimePipeline pipeline,
                                    BroadcastChannel broadcastChannel,
                                    ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.broadcastChannel = broadcastChannel;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var client = new WebSocketClientSubscription(session);
        connections.put(session.getId(), new Connection(client, broadcastChannel.subscribe(client)));
        log.info("WebSocket client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        MdcContext.setSession(session.getId());
        try {
            ControlAck ack = handle(message.getPayload());
            reply(session, ack);
        } finally {
            MdcContext.clear();
        }
    }

    ControlAck handle(String payload) {
        ControlMessage request;
        try {
            request = objectMapper.readValue(payload, ControlMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed control message: {}", e.getOriginalMessage());
            return ControlAck.error("Invalid message: " + e.getOriginalMessage());
        }
        ControlAck ack;
        try {
            ack = pipeline.handleControl(request);
        } catch (RuntimeException e) {
            log.error("Control message {} failed: {}", request.type(), e.getMessage(), e);
            return ControlAck.error("Request failed: " + e.getMessage());
        }
        if (ack.isError()) {
            log.debug("Control message {} answered with error: {}", request.type(), ack.error());
        }
        return ack;
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
        log.info("WebSocket client disconnected: {} ({})", session.getId(), status.getCode());
    }

    private void reply(WebSocketSession session, ControlAck ack) {
        Connection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        try {
            connection.client().send(objectMapper.writeValueAsString(ack));
        } catch (IOException e) {
            log.warn("Failed to acknowledge on {}: {}", session.getId(), e.getMessage());
            release(session);
        }
    }

    private void release(WebSocketSession session) {
        Connection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.subscription().unsubscribe();
        }
    }
}
