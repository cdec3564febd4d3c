package com.phoenixdash.app.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenixdash.gateway.events.PaymentEvent;
import com.phoenixdash.gateway.events.PaymentEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes payment events from the {@link PaymentEventBus} to every connected
 * dashboard WebSocket client.
 */
@Slf4j
@Component
public class PaymentEventBroadcaster {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final PaymentEventBus eventBus;
    private final ObjectMapper objectMapper;
    private Runnable unsubscribe;

    public PaymentEventBroadcaster(PaymentEventBus eventBus, ObjectMapper objectMapper) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void subscribe() {
        unsubscribe = eventBus.onEvent(this::broadcastToAll);
    }

    @PreDestroy
    public void unsubscribe() {
        if (unsubscribe != null) {
            unsubscribe.run();
        }
    }

    public void addSession(WebSocketSession session) {
        // raw sessions do not allow concurrent sends
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void removeSession(String sessionId) {
        sessions.remove(sessionId);
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Send {@code {type, seq, ts, payload}} to all open sessions.
     */
    public void broadcastToAll(PaymentEvent event) {
        String message;
        try {
            message = objectMapper.writeValueAsString(toFrame(event));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize payment event {}: {}", event.type(), e.getMessage());
            return;
        }
        for (WebSocketSession session : sessions.values()) {
            if (!session.isOpen()) {
                continue;
            }
            try {
                session.sendMessage(new TextMessage(message));
            } catch (Exception e) {
                log.warn("Failed to broadcast {} to {}: {}", event.type(), session.getId(), e.getMessage());
            }
        }
    }

    static Map<String, Object> toFrame(PaymentEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.type());
        frame.put("seq", event.seq());
        frame.put("ts", event.ts());
        frame.put("payload", event.payload());
        return frame;
    }
}
