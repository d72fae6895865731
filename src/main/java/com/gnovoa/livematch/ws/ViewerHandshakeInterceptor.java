package com.gnovoa.livematch.ws;

import com.gnovoa.livematch.model.Requester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Copies the caller's identity from the upgrade request into the session attributes: the
 * {@code X-User-Id}/{@code X-User-Role} headers and the {@code code} query parameter of a viewer
 * link. Access itself is decided by {@link WsRouter} once the match is known.
 */
public class ViewerHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ViewerHandshakeInterceptor.class);

    static final String REQUESTER = "requester";
    static final String VIEWER_CODE = "viewerCode";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String userId = request.getHeaders().getFirst("X-User-Id");
        if (userId != null && !userId.isBlank()) {
            try {
                attributes.put(REQUESTER, Requester.of(userId, request.getHeaders().getFirst("X-User-Role")));
            } catch (IllegalArgumentException e) {
                log.debug("Rejecting viewer handshake: {}", e.getMessage());
                response.setStatusCode(HttpStatus.BAD_REQUEST);
                return false;
            }
        }
        String code = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("code");
        if (code != null && !code.isBlank()) attributes.put(VIEWER_CODE, code);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to release
    }
}
