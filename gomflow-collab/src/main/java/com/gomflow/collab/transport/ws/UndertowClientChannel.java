package com.gomflow.collab.transport.ws;

import com.gomflow.collab.domain.session.ClientChannel;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * {@link ClientChannel} over an Undertow WebSocket. Sends are asynchronous.
 */
final class UndertowClientChannel implements ClientChannel {
    private static final Logger log = LoggerFactory.getLogger(UndertowClientChannel.class);

    private final String id;
    private final WebSocketChannel channel;

    private final WebSocketCallback<Void> sendCallback = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel ch, Void context) {
        }

        @Override
        public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
            log.warn("WS send failed on {}: {}", id, throwable.toString());
        }
    };

    UndertowClientChannel(String id, WebSocketChannel channel) {
        this.id = id;
        this.channel = channel;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) {
        WebSockets.sendText(text, channel, sendCallback);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public void close() {
        try {
            channel.sendClose();
        } catch (IOException e) {
            log.debug("WS close failed on {}: {}", id, e.toString());
        }
    }

    @Override
    public String toString() {
        return id + "@" + channel.getSourceAddress();
    }
}
