package com.example.adaptivestream.domain.model;

import java.net.URI;

/**
 * Payload of {@code onSourceChanged}: the URL the presentation layer should play from now on.
 */
public final class SourceChange {

    private final String providerName;
    private final URI sourceUri;
    private final QualityTier tier;
    private final double cursorSec;
    private final String reason;

    public SourceChange(String providerName, URI sourceUri, QualityTier tier, double cursorSec, String reason) {
        this.providerName = providerName;
        this.sourceUri = sourceUri;
        this.tier = tier;
        this.cursorSec = cursorSec;
        this.reason = reason;
    }

    public String getProviderName() {
        return providerName;
    }

    public URI getSourceUri() {
        return sourceUri;
    }

    public QualityTier getTier() {
        return tier;
    }

    public double getCursorSec() {
        return cursorSec;
    }

    /**
     * initial | failover | recovery | quality
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "SourceChange{" + providerName + ", " + tier + ", reason=" + reason + "}";
    }
}
