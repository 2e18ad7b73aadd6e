package com.agentarena.gateway.ws;

import com.agentarena.progression.ProgressionListener;
import com.agentarena.progression.ProgressionNotification;
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
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes progression notifications as JSON to every connected dashboard.
 */
@Component
public class NotificationWebSocketHandler extends TextWebSocketHandler implements ProgressionListener {

    private static final Logger log = LoggerFactory.getLogger(NotificationWebSocketHandler.class);

    private final ObjectMapper mapper;
    private final Set<WebSocketSession> sessions = new CopyOnWriteArraySet<>();

    public NotificationWebSocketHandler(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.debug("Dashboard connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        if ("ping".equalsIgnoreCase(message.getPayload().trim())) {
            send(session, new TextMessage("pong"));
        }
    }

    @Override
    public void onNotification(ProgressionNotification notification) {
        if (sessions.isEmpty()) return;
        TextMessage message;
        try {
            message = new TextMessage(mapper.writeValueAsString(notification));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise notification " + notification.type(), e);
        }
        for (var session : sessions) {
            if (!session.isOpen()) {
                sessions.remove(session);
                continue;
            }
            try {
                send(session, message);
            } catch (IOException e) {
                log.warn("Dropping dashboard session {}: {}", session.getId(), e.getMessage());
                sessions.remove(session);
            }
        }
    }

    int sessionCount() {
        return sessions.size();
    }

    private static void send(WebSocketSession session, TextMessage message) throws IOException {
        synchronized (session) {
            session.sendMessage(message);
        }
    }
}
