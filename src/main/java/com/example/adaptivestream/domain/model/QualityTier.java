package com.example.adaptivestream.domain.model;

import java.util.Objects;

/**
 * A (bitrate, vertical resolution) pair the content can be requested at.
 */
public final class QualityTier implements Comparable<QualityTier> {

    private final long bitrate;
    private final int height;

    public QualityTier(long bitrate, int height) {
        if (bitrate <= 0) {
            throw new IllegalArgumentException("bitrate must be positive: " + bitrate);
        }
        if (height <= 0) {
            throw new IllegalArgumentException("height must be positive: " + height);
        }
        this.bitrate = bitrate;
        this.height = height;
    }

    /**
     * Bits per second.
     */
    public long getBitrate() {
        return bitrate;
    }

    public int getHeight() {
        return height;
    }

    public String getLabel() {
        return height + "p";
    }

    @Override
    public int compareTo(QualityTier other) {
        int byBitrate = Long.compare(bitrate, other.bitrate);
        return byBitrate != 0 ? byBitrate : Integer.compare(height, other.height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualityTier)) {
            return false;
        }
        QualityTier that = (QualityTier) o;
        return bitrate == that.bitrate && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitrate, height);
    }

    @Override
    public String toString() {
        return getLabel() + "@" + bitrate;
    }
}
