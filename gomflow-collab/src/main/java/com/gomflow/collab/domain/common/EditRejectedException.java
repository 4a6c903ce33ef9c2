package com.gomflow.collab.domain.common;

/**
 * An order edit was refused: the sender does not hold the lock, or the
 * proposal was based on a stale version.
 */
public class EditRejectedException extends CollaborationException {

    public enum Reason {
        EDIT_LOCK_REQUIRED,
        VERSION_CONFLICT
    }

    private final String orderId;
    private final Reason reason;

    public EditRejectedException(String orderId, Reason reason, String message) {
        super(reason.name() + ": " + message);
        this.orderId = orderId;
        this.reason = reason;
    }

    public String getOrderId() {
        return orderId;
    }

    public Reason getReason() {
        return reason;
    }
}
