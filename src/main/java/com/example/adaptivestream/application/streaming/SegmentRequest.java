package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.domain.model.ByteRange;
import com.example.adaptivestream.domain.model.ChunkKey;
import com.example.adaptivestream.domain.model.QualityTier;
import com.example.adaptivestream.domain.model.TimeSpan;

public final class SegmentRequest {

    private final String contentId;
    private final QualityTier tier;
    private final TimeSpan span;
    private final ByteRange byteRange;
    private final boolean highPriority;

    public SegmentRequest(String contentId, QualityTier tier, TimeSpan span, boolean highPriority) {
        this.contentId = contentId;
        this.tier = tier;
        this.span = span;
        this.byteRange = ByteRange.forSpan(span, tier.getBitrate());
        this.highPriority = highPriority;
    }

    public ChunkKey chunkKey() {
        return new ChunkKey(ChunkKey.contentAddress(contentId, tier), byteRange.getFirst());
    }

    public String getContentId() {
        return contentId;
    }

    public QualityTier getTier() {
        return tier;
    }

    public TimeSpan getSpan() {
        return span;
    }

    public ByteRange getByteRange() {
        return byteRange;
    }

    public boolean isHighPriority() {
        return highPriority;
    }

    @Override
    public String toString() {
        return "SegmentRequest{" + contentId + "@" + tier.getLabel() + " " + span
                + (highPriority ? " high" : "") + "}";
    }
}
