package com.gnovoa.livematch.out;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.livematch.broadcast.MatchNotification;
import com.gnovoa.livematch.broadcast.MatchSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/** Pushes match notifications to one WebSocket session as JSON text frames. */
public final class WebSocketSessionSubscriber implements MatchSubscriber {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionSubscriber.class);

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    public WebSocketSessionSubscriber(WebSocketSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    @Override
    public void deliver(MatchNotification notification) throws IOException {
        if (!session.isOpen()) throw new IOException("Session " + session.getId() + " is closed");
        String json = mapper.writeValueAsString(notification);
        log.debug("Publishing {} to session {}", notification.type().wireName(), session.getId());
        session.sendMessage(new TextMessage(json));
    }
}
