package com.gomflow.collab.transport.ws;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WsHubTest {

    @Test
    void extractToken_prefersQueryParameter() {
        HttpServerExchange exchange = new HttpServerExchange(null);
        exchange.addQueryParam("token", "from-query");
        exchange.getRequestHeaders().put(Headers.AUTHORIZATION, "Bearer from-header");

        assertEquals("from-query", WsHub.extractToken(exchange));
    }

    @Test
    void extractToken_fallsBackToBearerHeader() {
        HttpServerExchange exchange = new HttpServerExchange(null);
        exchange.getRequestHeaders().put(Headers.AUTHORIZATION, "Bearer abc.def.ghi ");

        assertEquals("abc.def.ghi", WsHub.extractToken(exchange));
    }

    @Test
    void extractToken_ignoresOtherSchemes() {
        HttpServerExchange exchange = new HttpServerExchange(null);
        exchange.getRequestHeaders().put(Headers.AUTHORIZATION, "Basic dXNlcjpwdw==");

        assertNull(WsHub.extractToken(exchange));
    }

    @Test
    void extractToken_blankQueryFallsThrough() {
        HttpServerExchange exchange = new HttpServerExchange(null);
        exchange.addQueryParam("token", "");

        assertNull(WsHub.extractToken(exchange));
    }
}
