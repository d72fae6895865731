package com.gnovoa.livematch.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.livematch.broadcast.MatchNotification;
import com.gnovoa.livematch.broadcast.NotificationType;
import com.gnovoa.livematch.broadcast.Subscription;
import com.gnovoa.livematch.core.LiveMatchFacade;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.out.WebSocketSessionSubscriber;
import com.gnovoa.livematch.query.MatchReadService;
import com.gnovoa.livematch.query.MatchSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;

/**
 * Viewer channel {@code /ws/matches/{matchId}}. A new session first receives a {@code snapshot}
 * message and is then subscribed to the match's notifications. The session needs a viewer code for
 * the match or a requester allowed to open it; anything else is closed with a policy violation.
 */
@Component
public final class WsRouter extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsRouter.class);

    private static final String SUBSCRIPTION = "subscription";
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final LiveMatchFacade facade;
    private final MatchReadService reads;
    private final ObjectMapper mapper;
    private final Clock clock;

    public WsRouter(LiveMatchFacade facade, MatchReadService reads, ObjectMapper mapper, Clock clock) {
        this.facade = facade;
        this.reads = reads;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String matchId = matchId(session.getUri() == null ? "" : session.getUri().getPath());
        if (matchId == null) {
            session.close(CloseStatus.BAD_DATA.withReason("Unknown route"));
            return;
        }
        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        MatchSnapshot snapshot;
        try {
            snapshot = reads.viewerSnapshot(matchId,
                    (Requester) session.getAttributes().get(ViewerHandshakeInterceptor.REQUESTER),
                    (String) session.getAttributes().get(ViewerHandshakeInterceptor.VIEWER_CODE));
        } catch (MatchOperationException e) {
            log.debug("Refusing viewer for match {}: {}", matchId, e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION.withReason(e.kind().name()));
            return;
        }
        MatchNotification first = new MatchNotification(matchId, NotificationType.SNAPSHOT, clock.instant(), snapshot);
        out.sendMessage(new TextMessage(mapper.writeValueAsString(first)));
        Subscription sub = facade.subscribe(matchId, new WebSocketSessionSubscriber(out, mapper));
        session.getAttributes().put(SUBSCRIPTION, sub);
        log.debug("Viewer {} joined match {}", session.getId(), matchId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Subscription sub = (Subscription) session.getAttributes().remove(SUBSCRIPTION);
        if (sub != null) sub.close();
    }

    /** {@code /ws/matches/{matchId}} to {@code matchId}; null for any other path. */
    static String matchId(String path) {
        String[] p = path.split("/");
        if (path.contains("/ws/matches/") && p.length >= 4 && !p[p.length - 1].isBlank()) {
            return p[p.length - 1];
        }
        return null;
    }
}
