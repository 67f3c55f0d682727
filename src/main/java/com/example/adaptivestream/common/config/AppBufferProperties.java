package com.example.adaptivestream.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.buffer")
public class AppBufferProperties {

    /**
     * Seconds of buffer-ahead required to start or resume playback.
     */
    private double minimumSec = 2.0D;

    /**
     * Seconds of buffer-ahead considered healthy; fetching stops above this.
     */
    private double optimalSec = 10.0D;

    private long maxBufferBytes = 50L * 1024 * 1024;

    /**
     * Seconds behind the cursor that are never evicted.
     */
    private double retentionSec = 30.0D;

    private long stallTimeoutMs = 5000;

    /**
     * Media seconds covered by one segment request.
     */
    private double segmentDurationSec = 2.0D;

    private long checkIntervalMs = 500;

    /**
     * Upper bound on how long a seek may suppress stall classification.
     * Zero or negative means "same as stallTimeoutMs".
     */
    private long seekGraceMs = 0;

    public long effectiveSeekGraceMs() {
        return seekGraceMs > 0 ? seekGraceMs : stallTimeoutMs;
    }
}
