package com.example.adaptivestream.domain.model;

import java.util.Locale;

public enum SessionState {
    IDLE,
    RESOLVING,
    LOADING,
    PLAYING,
    BUFFERING,
    RECOVERING,
    FAILED,
    DISPOSED;

    /**
     * States in which content is being fetched for a live handle.
     */
    public boolean isStreaming() {
        return this == LOADING || this == PLAYING || this == BUFFERING || this == RECOVERING;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
