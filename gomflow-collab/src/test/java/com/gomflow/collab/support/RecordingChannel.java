package com.gomflow.collab.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.session.ClientChannel;
import com.gomflow.collab.util.Json;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ClientChannel that keeps every frame it was sent.
 */
public final class RecordingChannel implements ClientChannel {

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    public RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) {
        frames.add(text);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    public List<JsonNode> frames() {
        List<JsonNode> parsed = new ArrayList<>();
        for (String frame : frames) {
            try {
                parsed.add(Json.MAPPER.readTree(frame));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        return parsed;
    }

    public List<String> events() {
        List<String> names = new ArrayList<>();
        for (JsonNode frame : frames()) {
            names.add(frame.path("event").asText());
        }
        return names;
    }

    /**
     * Payloads of every frame with the given event name, in arrival order.
     */
    public List<JsonNode> payloads(String event) {
        List<JsonNode> result = new ArrayList<>();
        for (JsonNode frame : frames()) {
            if (event.equals(frame.path("event").asText())) {
                result.add(frame.path("payload"));
            }
        }
        return result;
    }

    public JsonNode lastPayload(String event) {
        List<JsonNode> all = payloads(event);
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    public int count(String event) {
        return payloads(event).size();
    }

    public void clear() {
        frames.clear();
    }
}
