package com.phoenixdash.app.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Push-only endpoint: clients connect and receive payment events. Inbound
 * messages are ignored.
 */
@Slf4j
public class PaymentEventWebSocketHandler extends TextWebSocketHandler {

    private final PaymentEventBroadcaster broadcaster;

    public PaymentEventWebSocketHandler(PaymentEventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        broadcaster.addSession(session);
        log.info("WebSocket client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        log.debug("Ignoring inbound message on {}", session.getId());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WebSocket error on {}: {}", session.getId(), exception.getMessage());
        broadcaster.removeSession(session.getId());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        broadcaster.removeSession(session.getId());
        log.info("WebSocket client disconnected: {} ({})", session.getId(), status.getCode());
    }
}
