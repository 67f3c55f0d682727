package com.example.adaptivestream.domain.model;

/**
 * What validation learned about a content id.
 */
public final class ContentMetadata {

    private final String contentId;
    private final Double durationSec;
    private final long totalBytes;
    private final boolean preloaded;

    public ContentMetadata(String contentId, Double durationSec, long totalBytes, boolean preloaded) {
        this.contentId = contentId;
        this.durationSec = durationSec;
        this.totalBytes = totalBytes;
        this.preloaded = preloaded;
    }

    public static ContentMetadata preloaded(String contentId) {
        return new ContentMetadata(contentId, null, 0L, true);
    }

    public String getContentId() {
        return contentId;
    }

    /**
     * Null when the metadata carries no duration; the end is then found by range probing.
     */
    public Double getDurationSec() {
        return durationSec;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public boolean isPreloaded() {
        return preloaded;
    }
}
