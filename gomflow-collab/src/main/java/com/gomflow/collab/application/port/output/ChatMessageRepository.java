package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.chat.ChatMessage;

/**
 * Chat history store.
 */
public interface ChatMessageRepository {

    /**
     * Insert a message draft.
     *
     * @return the stored message with ID and creation time
     */
    ChatMessage insert(ChatMessage draft);
}
