package com.example.adaptivestream.domain.model;

import java.util.Objects;

/**
 * Content-address key of a fetched chunk. The address names the content at one tier,
 * so byte offsets of different tiers never collide.
 */
public final class ChunkKey {

    private final String contentAddress;
    private final long byteOffset;

    public ChunkKey(String contentAddress, long byteOffset) {
        this.contentAddress = contentAddress;
        this.byteOffset = byteOffset;
    }

    public static String contentAddress(String contentId, QualityTier tier) {
        return contentId + "@" + tier.getLabel();
    }

    public String getContentAddress() {
        return contentAddress;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChunkKey)) {
            return false;
        }
        ChunkKey that = (ChunkKey) o;
        return byteOffset == that.byteOffset && contentAddress.equals(that.contentAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentAddress, byteOffset);
    }

    @Override
    public String toString() {
        return contentAddress + "#" + byteOffset;
    }
}
