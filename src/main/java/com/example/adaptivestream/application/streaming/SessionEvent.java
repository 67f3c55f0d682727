package com.example.adaptivestream.application.streaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SessionEvent {

    private final long sequence;
    private final long timestampMs;
    private final String type;
    private final Map<String, String> attributes;

    public SessionEvent(long sequence, long timestampMs, String type, Map<String, String> attributes) {
        this.sequence = sequence;
        this.timestampMs = timestampMs;
        this.type = type;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public long getSequence() {
        return sequence;
    }

    public long getTimestampMs() {
        return timestampMs;
    }

    /**
     * sourceChanged | qualityChanged | bufferHealth | recoverableError | fatalError | stateChanged
     */
    public String getType() {
        return type;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }
}
