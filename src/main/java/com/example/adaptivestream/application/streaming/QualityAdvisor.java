package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppQualityProperties;
import com.example.adaptivestream.domain.model.BufferHealth;
import com.example.adaptivestream.domain.model.DecodeCostSignal;
import com.example.adaptivestream.domain.model.QualityTier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Picks the quality tier for one session.
 *
 * <p>Bandwidth-driven switches are rate limited to one per {@code minSwitchIntervalMs}. Low
 * buffer health overrides that: the first LOW observation of an episode steps one tier down
 * at once, and no upgrade happens while health is not HEALTHY. The LOW episode ends only when
 * health returns to HEALTHY.
 */
public class QualityAdvisor {

    private final List<QualityTier> tiers;
    private final double headroom;
    private final long minSwitchIntervalMs;

    private QualityTier active;
    private long lastSwitchAtMs;
    private boolean autoEnabled = true;
    private boolean lowDowngradeTaken;

    public QualityAdvisor(List<QualityTier> tiers, double headroom, long minSwitchIntervalMs) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("at least one quality tier is required");
        }
        List<QualityTier> sorted = new ArrayList<>(tiers);
        Collections.sort(sorted);
        this.tiers = Collections.unmodifiableList(sorted);
        this.headroom = headroom;
        this.minSwitchIntervalMs = minSwitchIntervalMs;
        this.active = sorted.get(0);
    }

    public static QualityAdvisor fromProperties(AppQualityProperties properties) {
        List<QualityTier> tiers = new ArrayList<>();
        for (AppQualityProperties.Tier tier : properties.getTiers()) {
            tiers.add(new QualityTier(tier.getBitrate(), tier.getHeight()));
        }
        return new QualityAdvisor(tiers, properties.getBandwidthHeadroom(), properties.getMinSwitchIntervalMs());
    }

    /**
     * Starts a new content handle: the lowest tier, or the pinned tier when auto is off. The
     * initial selection counts as a switch for rate limiting.
     */
    public synchronized QualityTier reset(long nowMs) {
        if (autoEnabled) {
            active = tiers.get(0);
        }
        lastSwitchAtMs = nowMs;
        lowDowngradeTaken = false;
        return active;
    }

    /**
     * @param bandwidthBps smoothed estimate, zero or negative when none is available yet
     * @param decodeCost   optional, null means no penalty
     * @return the tier to play from now on
     */
    public synchronized QualityTier recommend(double bandwidthBps, BufferHealth health,
                                              DecodeCostSignal decodeCost, long nowMs) {
        if (!autoEnabled) {
            return active;
        }
        if (health == BufferHealth.HEALTHY) {
            lowDowngradeTaken = false;
        }
        if (health == BufferHealth.LOW && !lowDowngradeTaken) {
            lowDowngradeTaken = true;
            QualityTier lower = stepDown(active);
            if (!lower.equals(active)) {
                switchTo(lower, nowMs);
            }
            return active;
        }
        QualityTier candidate = bandwidthCandidate(bandwidthBps, decodeCost);
        if (candidate == null || candidate.equals(active)) {
            return active;
        }
        boolean upgrade = candidate.compareTo(active) > 0;
        if (upgrade && health != BufferHealth.HEALTHY) {
            return active;
        }
        if (nowMs - lastSwitchAtMs >= minSwitchIntervalMs) {
            switchTo(candidate, nowMs);
        }
        return active;
    }

    /**
     * Pins a tier from the configured table and turns automatic adaptation off.
     */
    public synchronized QualityTier forceTier(QualityTier tier, long nowMs) {
        if (!tiers.contains(tier)) {
            throw new IllegalArgumentException("unknown quality tier " + tier);
        }
        autoEnabled = false;
        if (!tier.equals(active)) {
            switchTo(tier, nowMs);
        }
        return active;
    }

    public synchronized void setAutoQuality(boolean enabled) {
        this.autoEnabled = enabled;
    }

    public synchronized boolean isAutoEnabled() {
        return autoEnabled;
    }

    public synchronized QualityTier getActiveTier() {
        return active;
    }

    public List<QualityTier> getTiers() {
        return tiers;
    }

    /**
     * Looks a tier up by label ("720p") or height ("720").
     */
    public QualityTier findTier(String label) {
        if (label == null) {
            throw new IllegalArgumentException("quality tier label is required");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (QualityTier tier : tiers) {
            if (tier.getLabel().equals(normalized) || String.valueOf(tier.getHeight()).equals(normalized)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("unknown quality tier " + label);
    }

    private QualityTier bandwidthCandidate(double bandwidthBps, DecodeCostSignal decodeCost) {
        if (bandwidthBps <= 0D || Double.isNaN(bandwidthBps)) {
            return null;
        }
        double effective = bandwidthBps * (decodeCost == null ? 1D : decodeCost.bandwidthFactor());
        double budget = effective * headroom;
        QualityTier best = tiers.get(0);
        for (QualityTier tier : tiers) {
            if (tier.getBitrate() <= budget) {
                best = tier;
            }
        }
        return best;
    }

    private QualityTier stepDown(QualityTier tier) {
        int index = tiers.indexOf(tier);
        return index > 0 ? tiers.get(index - 1) : tiers.get(0);
    }

    private void switchTo(QualityTier tier, long nowMs) {
        active = tier;
        lastSwitchAtMs = nowMs;
    }
}
