package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionError;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.SourceChange;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CompositeSessionListener implements StreamSessionListener {

    private final List<StreamSessionListener> delegates;

    public CompositeSessionListener(StreamSessionListener... delegates) {
        this.delegates = new ArrayList<>(Arrays.asList(delegates));
    }

    @Override
    public void onSourceChanged(String sessionId, SourceChange change) {
        for (StreamSessionListener delegate : delegates) {
            delegate.onSourceChanged(sessionId, change);
        }
    }

    @Override
    public void onQualityChanged(String sessionId, QualityTier tier) {
        for (StreamSessionListener delegate : delegates) {
            delegate.onQualityChanged(sessionId, tier);
        }
    }

    @Override
    public void onBufferHealth(String sessionId, BufferHealth health) {
        for (StreamSessionListener delegate : delegates) {
            delegate.onBufferHealth(sessionId, health);
        }
    }

    @Override
    public void onRecoverableError(String sessionId, SessionError error) {
        for (StreamSessionListener delegate : delegates) {
            delegate.onRecoverableError(sessionId, error);
        }
    }

    @Override
    public void onFatalError(String sessionId, SessionError error) {
        for (StreamSessionListener delegate : delegates) {
            delegate.onFatalError(sessionId, error);
        }
    }

    @Override
    public void onStateChanged(String sessionId, SessionState from, SessionState to) {
        for (StreamSessionListener delegate : delegates) {
            delegate.onStateChanged(sessionId, from, to);
        }
    }
}
