package com.gomflow.collab.security;

import com.gomflow.collab.domain.common.ProtocolException;

import java.util.regex.Pattern;

/**
 * Input validator for inbound collaboration events.
 *
 * Runs before any state changes; every failure is a {@link ProtocolException}.
 *
 * Validation Rules:
 * - IDs: letters, digits, '-' and '_', 1..64 chars (UUIDs pass)
 * - Field paths: dotted segments with optional array indexes, max 255 chars
 * - Pages: max 255 chars, no control characters
 * - Chat content: not blank, max 4000 chars
 */
public class InputValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final Pattern FIELD_PATH_PATTERN =
        Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\[[0-9]+])?(\\.[A-Za-z_][A-Za-z0-9_]*(\\[[0-9]+])?)*$");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}]");

    static final int MAX_FIELD_PATH_LENGTH = 255;
    static final int MAX_PAGE_LENGTH = 255;
    static final int MAX_CHAT_LENGTH = 4000;

    public boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    /**
     * @return the ID, unchanged
     * @throws ProtocolException if missing or malformed
     */
    public String requireId(String field, String id) {
        if (id == null || id.isBlank()) {
            throw new ProtocolException(field + " is required");
        }
        if (!isValidId(id)) {
            throw new ProtocolException(field + " is malformed");
        }
        return id;
    }

    /**
     * Null passes; anything else must be a valid ID.
     */
    public String optionalId(String field, String id) {
        return id == null ? null : requireId(field, id);
    }

    public String requireFieldPath(String fieldPath) {
        if (fieldPath == null || fieldPath.isBlank()) {
            throw new ProtocolException("fieldPath is required");
        }
        if (fieldPath.length() > MAX_FIELD_PATH_LENGTH || !FIELD_PATH_PATTERN.matcher(fieldPath).matches()) {
            throw new ProtocolException("fieldPath is malformed");
        }
        return fieldPath;
    }

    public String optionalPage(String page) {
        if (page == null) {
            return null;
        }
        if (page.length() > MAX_PAGE_LENGTH || CONTROL_CHARS.matcher(page).find()) {
            throw new ProtocolException("currentPage is malformed");
        }
        return page;
    }

    public String requireChatContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ProtocolException("Message content is required");
        }
        if (content.length() > MAX_CHAT_LENGTH) {
            throw new ProtocolException("Message content exceeds " + MAX_CHAT_LENGTH + " characters");
        }
        return content;
    }
}
