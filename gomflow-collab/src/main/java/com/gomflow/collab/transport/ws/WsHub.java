package com.gomflow.collab.transport.ws;

import com.gomflow.collab.auth.SessionAuthenticator;
import com.gomflow.collab.domain.common.AuthenticationException;
import com.gomflow.collab.domain.session.ClientConnection;
import com.gomflow.collab.domain.user.User;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.UUID;

/**
 * Undertow-native WebSocket endpoint for collaboration clients.
 *
 * - Credential from ?token=xxx or "Authorization: Bearer xxx"
 * - Authentication happens before the upgrade; a rejected credential gets
 *   HTTP 401 and no connection state is created
 * - Frames are handed to {@link CollaborationEventRouter}; close always runs
 *   the router's disconnect cleanup
 */
public final class WsHub {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);

    static final AttachmentKey<User> USER = AttachmentKey.create(User.class);

    private final SessionAuthenticator authenticator;
    private final CollaborationEventRouter router;

    public WsHub(SessionAuthenticator authenticator, CollaborationEventRouter router) {
        this.authenticator = authenticator;
        this.router = router;
    }

    public HttpHandler websocketHandler() {
        WebSocketProtocolHandshakeHandler handshake = new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                WsHub.this.onConnect(exchange, channel);
            }
        });
        return new AuthenticatingHandler(handshake);
    }

    /**
     * Authenticates the upgrade request off the IO thread, then hands over to
     * the handshake.
     */
    private final class AuthenticatingHandler implements HttpHandler {
        private final HttpHandler next;

        AuthenticatingHandler(HttpHandler next) {
            this.next = next;
        }

        @Override
        public void handleRequest(HttpServerExchange exchange) throws Exception {
            if (exchange.isInIoThread()) {
                exchange.dispatch(this);
                return;
            }

            User user;
            try {
                user = authenticator.authenticate(extractToken(exchange));
            } catch (AuthenticationException e) {
                log.warn("WS handshake rejected from {}: {}", exchange.getSourceAddress(), e.getMessage());
                exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(e.getMessage());
                return;
            }

            exchange.putAttachment(USER, user);
            next.handleRequest(exchange);
        }
    }

    private void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        User user = exchange.getAttachment(USER);
        if (user == null) {
            log.warn("WS connection without authenticated user from {}", channel.getSourceAddress());
            new UndertowClientChannel("unauthenticated", channel).close();
            return;
        }

        UndertowClientChannel clientChannel = new UndertowClientChannel(UUID.randomUUID().toString(), channel);
        ClientConnection connection = router.onOpen(user, clientChannel);
        log.info("WS connected: {} (user={}, connection={})",
            channel.getSourceAddress(), user.userId(), connection.getConnectionId());

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                router.onMessage(connection, message.getData());
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.warn("WS error on {}: {}", connection.getConnectionId(), error.toString());
                super.onError(ch, error);
            }
        });

        channel.addCloseTask(ch -> {
            log.info("WS disconnected: {} (user={}, connection={})",
                ch.getSourceAddress(), user.userId(), connection.getConnectionId());
            router.onClose(connection);
        });

        channel.resumeReceives();
    }

    static String extractToken(HttpServerExchange exchange) {
        Deque<String> tokens = exchange.getQueryParameters().get("token");
        if (tokens != null && !tokens.isEmpty() && !tokens.getFirst().isBlank()) {
            return tokens.getFirst();
        }
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header != null && header.startsWith("Bearer ")) {
            return header.substring(7).trim();
        }
        return null;
    }
}
