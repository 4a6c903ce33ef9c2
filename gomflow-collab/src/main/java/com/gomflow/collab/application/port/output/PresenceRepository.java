package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.presence.PresenceRecord;

/**
 * System of record for presence.
 */
public interface PresenceRepository {

    /**
     * Insert or update the (user, workspace) presence row. Null page or cursor
     * keeps the stored value.
     */
    void upsert(PresenceRecord record);
}
