package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.SessionState;
import com.example.adaptivestream.domain.model.TimeSpan;
import java.net.URI;
import java.util.List;
import lombok.Data;

/**
 * Point-in-time view of a session, taken under the session lock.
 */
@Data
public class SessionSnapshot {

    private String sessionId;
    private SessionState state;
    private String contentId;
    private String providerName;
    private URI sourceUri;
    private QualityTier tier;
    private boolean autoQuality;
    private double cursorSec;
    private BufferHealth health;
    private double bufferAheadSec;
    private List<TimeSpan> bufferedRanges;
    private long bufferedBytes;
    private Double contentEndSec;
    private double bandwidthBps;
    private int outstandingFetches;
    private int providerSwitches;
    private boolean seeking;
    private long lastActivityMs;
}
