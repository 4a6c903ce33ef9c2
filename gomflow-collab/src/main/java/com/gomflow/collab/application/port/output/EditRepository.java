package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.edit.EditRecord;

/**
 * Append-only operational transform log.
 */
public interface EditRepository {

    /**
     * Append an edit record.
     *
     * @return the stored record, with its store-assigned ID
     */
    EditRecord append(EditRecord record);

    /**
     * Apply a stored edit to its order. The store applies it only when the
     * order's current version equals the edit's base version, then bumps the
     * order version by one.
     *
     * @return true if applied, false on version mismatch
     */
    boolean apply(EditRecord stored);
}
