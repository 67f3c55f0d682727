package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.SourceChange;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded log of a session's notifications for clients that poll instead of subscribing.
 * The oldest events are dropped once capacity is reached; sequence numbers keep growing so a
 * poller can tell that it missed some.
 */
public class SessionEventLog implements StreamSessionListener {

    private final int capacity;
    private final Clock clock;
    private final Deque<SessionEvent> events = new ArrayDeque<>();
    private long nextSequence = 1L;

    public SessionEventLog(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Events with a sequence number greater than {@code afterSequence}, oldest first.
     */
    public synchronized List<SessionEvent> since(long afterSequence) {
        List<SessionEvent> result = new ArrayList<>();
        for (SessionEvent event : events) {
            if (event.getSequence() > afterSequence) {
                result.add(event);
            }
        }
        return result;
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized long lastSequence() {
        return nextSequence - 1L;
    }

    @Override
    public void onSourceChanged(String sessionId, SourceChange change) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("provider", change.getProviderName());
        attributes.put("uri", String.valueOf(change.getSourceUri()));
        attributes.put("tier", change.getTier() == null ? null : change.getTier().getLabel());
        attributes.put("cursorSec", String.valueOf(change.getCursorSec()));
        attributes.put("reason", change.getReason());
        append("sourceChanged", attributes);
    }

    @Override
    public void onQualityChanged(String sessionId, QualityTier tier) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("tier", tier.getLabel());
        attributes.put("bitrate", String.valueOf(tier.getBitrate()));
        append("qualityChanged", attributes);
    }

    @Override
    public void onBufferHealth(String sessionId, BufferHealth health) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("health", health.name());
        append("bufferHealth", attributes);
    }

    @Override
    public void onRecoverableError(String sessionId, SessionError error) {
        append("recoverableError", errorAttributes(error));
    }

    @Override
    public void onFatalError(String sessionId, SessionError error) {
        append("fatalError", errorAttributes(error));
    }

    @Override
    public void onStateChanged(String sessionId, SessionState from, SessionState to) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("from", from.value());
        attributes.put("to", to.value());
        append("stateChanged", attributes);
    }

    private Map<String, String> errorAttributes(SessionError error) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("kind", error.getKind().name());
        attributes.put("message", error.getMessage());
        attributes.putAll(error.getContext());
        return attributes;
    }

    private synchronized void append(String type, Map<String, String> attributes) {
        events.addLast(new SessionEvent(nextSequence++, clock.nowMs(), type, attributes));
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }
}
