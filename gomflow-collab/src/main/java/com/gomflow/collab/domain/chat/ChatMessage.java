package com.gomflow.collab.domain.chat;

import java.time.Instant;

/**
 * Workspace chat message. messageId and createdAt are assigned by the chat store.
 */
public record ChatMessage(
    String messageId,
    String workspaceId,
    String userId,
    String threadId,
    String parentMessageId,
    ChatMessageType messageType,
    String content,
    Instant createdAt
) {
    public static ChatMessage draft(String workspaceId, String userId, String threadId,
                                    String parentMessageId, ChatMessageType type, String content) {
        return new ChatMessage(null, workspaceId, userId, threadId, parentMessageId, type, content, null);
    }
}
