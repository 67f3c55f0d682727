package com.example.adaptivestream.application.streaming;

public final class ProviderScoreEntry {

    private final String providerName;
    private final double score;
    private final int consecutiveFailures;

    public ProviderScoreEntry(String providerName, double score, int consecutiveFailures) {
        this.providerName = providerName;
        this.score = score;
        this.consecutiveFailures = consecutiveFailures;
    }

    public String getProviderName() {
        return providerName;
    }

    public double getScore() {
        return score;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
