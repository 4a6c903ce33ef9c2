package com.gomflow.collab.domain.session;

/**
 * Outbound side of one open socket.
 */
public interface ClientChannel {

    String id();

    /**
     * Queue a text frame. Must not block on the network.
     */
    void send(String text);

    boolean isOpen();

    void close();
}
