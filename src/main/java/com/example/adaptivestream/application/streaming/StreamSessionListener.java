package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.SourceChange;

/**
 * Decisions pushed to the presentation layer. Calls for one session are serialized and made
 * while the session lock is held, so implementations must not call back into the session from
 * another thread and wait for it.
 */
public interface StreamSessionListener {

    void onSourceChanged(String sessionId, SourceChange change);

    void onQualityChanged(String sessionId, QualityTier tier);

    void onBufferHealth(String sessionId, BufferHealth health);

    void onRecoverableError(String sessionId, SessionError error);

    void onFatalError(String sessionId, SessionError error);

    default void onStateChanged(String sessionId, SessionState from, SessionState to) {
    }
}
