package com.gomflow.collab.infrastructure.persistence;

import com.gomflow.collab.application.port.output.ChatMessageRepository;
import com.gomflow.collab.domain.chat.ChatMessage;
import com.gomflow.collab.domain.common.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public final class PostgresChatMessageRepository implements ChatMessageRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresChatMessageRepository.class);

    private final DataSource dataSource;

    public PostgresChatMessageRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ChatMessage insert(ChatMessage draft) {
        String sql = """
                INSERT INTO chat_messages (
                    workspace_id, user_id, thread_id, parent_message_id, message_type, content
                ) VALUES (?::uuid, ?::uuid, ?::uuid, ?::uuid, ?::chat_message_type, ?)
                RETURNING id, created_at
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, draft.workspaceId());
            ps.setString(2, draft.userId());
            ps.setString(3, draft.threadId());
            ps.setString(4, draft.parentMessageId());
            ps.setString(5, draft.messageType().wireName());
            ps.setString(6, draft.content());

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("INSERT returned no row");
                }
                return new ChatMessage(
                    rs.getString("id"),
                    draft.workspaceId(),
                    draft.userId(),
                    draft.threadId(),
                    draft.parentMessageId(),
                    draft.messageType(),
                    draft.content(),
                    rs.getTimestamp("created_at").toInstant()
                );
            }
        } catch (SQLException e) {
            log.error("Failed to insert chat message in workspace {}: {}", draft.workspaceId(), e.getMessage());
            throw new PersistenceException("chat_messages.insert", e);
        }
    }
}
