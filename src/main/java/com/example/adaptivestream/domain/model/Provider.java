package com.example.adaptivestream.domain.model;

import java.net.URI;
import java.util.Locale;

/**
 * Immutable snapshot of a content source and its reliability state. The registry replaces
 * snapshots atomically; callers never mutate a provider.
 */
public final class Provider {

    private final String name;
    private final String displayName;
    private final String urlTemplate;
    private final double score;
    private final int consecutiveFailures;
    private final long cooldownUntilMs;
    private final boolean disabled;
    private final boolean probationary;
    private final long lastSuccessAtMs;
    private final long disabledAtMs;

    public Provider(String name, String displayName, String urlTemplate, double score) {
        this(name, displayName, urlTemplate, score, 0, 0L, false, false, 0L, 0L);
    }

    private Provider(String name, String displayName, String urlTemplate, double score,
                     int consecutiveFailures, long cooldownUntilMs, boolean disabled,
                     boolean probationary, long lastSuccessAtMs, long disabledAtMs) {
        this.name = name;
        this.displayName = displayName;
        this.urlTemplate = urlTemplate;
        this.score = clampScore(score);
        this.consecutiveFailures = consecutiveFailures;
        this.cooldownUntilMs = cooldownUntilMs;
        this.disabled = disabled;
        this.probationary = probationary;
        this.lastSuccessAtMs = lastSuccessAtMs;
        this.disabledAtMs = disabledAtMs;
    }

    public Provider withSuccess(double gain, long nowMs) {
        double next = score + (1D - score) * gain;
        return new Provider(name, displayName, urlTemplate, next, 0, cooldownUntilMs, disabled,
                false, nowMs, disabledAtMs);
    }

    /**
     * Applies one failure. The decay compounds with the length of the failure streak, so a
     * provider timing out repeatedly drops faster than one failing sporadically.
     */
    public Provider withFailure(double decayFactor, int retryBudget, double threshold, long cooldownMs, long nowMs) {
        int failures = consecutiveFailures + 1;
        double next = score * Math.pow(decayFactor, failures);
        long cooldownUntil = cooldownUntilMs;
        long disabledAt = disabledAtMs;
        boolean onProbation = probationary;
        boolean overBudget = failures > retryBudget;
        boolean belowThreshold = next < threshold;
        if (overBudget || belowThreshold) {
            cooldownUntil = nowMs + cooldownMs;
            disabledAt = nowMs;
            onProbation = belowThreshold;
        }
        return new Provider(name, displayName, urlTemplate, next, failures, cooldownUntil, disabled,
                onProbation, lastSuccessAtMs, disabledAt);
    }

    public Provider withDisabled(long nowMs) {
        return new Provider(name, displayName, urlTemplate, score, consecutiveFailures, cooldownUntilMs, true,
                probationary, lastSuccessAtMs, nowMs);
    }

    /**
     * Clears the override and any cooldown. The provider is selectable again even if its score
     * sits below the threshold, until the next outcome is reported.
     */
    public Provider withEnabled() {
        return new Provider(name, displayName, urlTemplate, score, 0, 0L, false,
                true, lastSuccessAtMs, disabledAtMs);
    }

    public Provider withScore(double restoredScore) {
        return new Provider(name, displayName, urlTemplate, restoredScore, consecutiveFailures, cooldownUntilMs,
                disabled, probationary, lastSuccessAtMs, disabledAtMs);
    }

    public boolean isCoolingDown(long nowMs) {
        return nowMs < cooldownUntilMs;
    }

    /**
     * Selectable by rank(): not administratively disabled, not cooling down, and either above
     * the threshold or back on probation after its cooldown.
     */
    public boolean isEligible(double threshold, long nowMs) {
        if (disabled || isCoolingDown(nowMs)) {
            return false;
        }
        return score >= threshold || probationary;
    }

    /**
     * Source URL for the content at the given tier. Templates without a quality placeholder
     * get the tier as a {@code quality} query parameter.
     */
    public URI resolveUri(String contentId, QualityTier tier) {
        String url = urlTemplate.replace("{contentId}", contentId);
        boolean tierInTemplate = url.contains("{height}") || url.contains("{bitrate}");
        if (tier != null) {
            url = url.replace("{height}", String.valueOf(tier.getHeight()))
                    .replace("{bitrate}", String.valueOf(tier.getBitrate()));
            if (!tierInTemplate) {
                url = url + (url.indexOf('?') >= 0 ? "&" : "?") + "quality=" + tier.getLabel();
            }
        }
        return URI.create(url);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getUrlTemplate() {
        return urlTemplate;
    }

    public double getScore() {
        return score;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public long getCooldownUntilMs() {
        return cooldownUntilMs;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public boolean isProbationary() {
        return probationary;
    }

    public long getLastSuccessAtMs() {
        return lastSuccessAtMs;
    }

    public long getDisabledAtMs() {
        return disabledAtMs;
    }

    private static double clampScore(double value) {
        if (Double.isNaN(value)) {
            return 0D;
        }
        return Math.max(0D, Math.min(1D, value));
    }

    @Override
    public String toString() {
        return "Provider{" + name + ", score=" + String.format(Locale.ROOT, "%.3f", score)
                + ", failures=" + consecutiveFailures + ", disabled=" + disabled + "}";
    }
}
