package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gomflow.collab.application.port.output.ChatMessageRepository;
import com.gomflow.collab.domain.activity.ActivityEntry;
import com.gomflow.collab.domain.activity.ActivityType;
import com.gomflow.collab.domain.chat.ChatMessage;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Workspace chat and typing indicators.
 *
 * Chat messages are stored first and then sent to the whole room, sender
 * included. Typing indicators are never stored and skip the sender.
 */
public final class ChatRelay {
    private static final Logger log = LoggerFactory.getLogger(ChatRelay.class);

    private final ChatMessageRepository repository;
    private final RoomBroadcaster broadcaster;
    private final ActivityRecorder activityRecorder;
    private final Clock clock;

    public ChatRelay(ChatMessageRepository repository, RoomBroadcaster broadcaster,
                     ActivityRecorder activityRecorder, Clock clock) {
        this.repository = repository;
        this.broadcaster = broadcaster;
        this.activityRecorder = activityRecorder;
        this.clock = clock;
    }

    public ChatMessage post(ChatMessage draft) {
        ChatMessage stored = repository.insert(draft);
        broadcaster.broadcast(stored.workspaceId(), EventType.CHAT_MESSAGE,
            Payloads.chatMessage(stored, clock.instant()), null);

        ObjectNode metadata = Json.MAPPER.createObjectNode();
        metadata.put("messageType", stored.messageType().wireName());
        activityRecorder.record(ActivityEntry.of(stored.workspaceId(), stored.userId(), ActivityType.CHAT_MESSAGE,
            "chat_message", stored.messageId(), metadata, null));

        log.debug("Chat message {} posted in workspace {}", stored.messageId(), stored.workspaceId());
        return stored;
    }

    public int typing(String userId, String workspaceId, String channelId, boolean isTyping) {
        return broadcaster.broadcast(workspaceId, EventType.TYPING_INDICATOR,
            Payloads.typing(userId, workspaceId, channelId, isTyping, clock.instant()), userId);
    }
}
