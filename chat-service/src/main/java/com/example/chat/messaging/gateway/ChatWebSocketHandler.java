package com.example.chat.messaging.gateway;

import com.example.chat.messaging.session.WebSocketSessionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * WebSocket endpoint for the real-time channel. The bearer token comes from the
 * {@code token} query parameter or the {@code Authorization} header of the handshake.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatWebSocketHandler implements WebSocketHandler {

    private final ConnectionGateway gateway;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketSessionHandle handle = new WebSocketSessionHandle(session.getId());
        String token = resolveToken(session);

        Mono<Void> outbound = session.send(handle.outbound().map(session::textMessage))
                .then(Mono.defer(() -> session.close(handle.closeStatus())));

        Mono<Void> inbound = gateway.connect(token, handle)
                .flatMap(userId -> session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .concatMap(frame -> gateway.onInbound(userId, handle, frame))
                        .doFinally(signal -> handle.close("connection closed"))
                        .then(gateway.onDisconnect(userId, handle)))
                .doOnError(e -> log.warn("WebSocket session {} terminated with error: {}", session.getId(), e.getMessage()))
                .onErrorResume(e -> Mono.empty());

        return Mono.when(inbound, outbound);
    }

    static String resolveToken(WebSocketSession session) {
        URI uri = session.getHandshakeInfo().getUri();
        String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
        if (token != null && !token.isBlank()) {
            return token;
        }
        String header = session.getHandshakeInfo().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        return header != null && header.regionMatches(true, 0, "Bearer ", 0, 7) ? header.substring(7).trim() : null;
    }
}
