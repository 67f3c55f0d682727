package com.example.adaptivestream.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.provider")
public class AppProviderProperties {

    private List<Endpoint> endpoints = new ArrayList<>(Arrays.asList(
            new Endpoint("ipfs.io", "IPFS Gateway", "https://ipfs.io/ipfs/{contentId}"),
            new Endpoint("algonode.xyz", "Algonode", "https://ipfs.algonode.xyz/ipfs/{contentId}"),
            new Endpoint("eth.aragon.network", "Aragon", "https://ipfs.eth.aragon.network/ipfs/{contentId}"),
            new Endpoint("dweb.link", "IPFS", "https://{contentId}.ipfs.dweb.link"),
            new Endpoint("flk-ipfs.xyz", "Fleek", "https://{contentId}.ipfs.flk-ipfs.xyz")));

    /**
     * Score given to providers with no persisted history.
     */
    private double initialScore = 1.0D;

    /**
     * Fraction of the distance to 1.0 recovered on each success.
     */
    private double successGain = 0.1D;

    /**
     * Multiplicative decay applied per consecutive failure.
     */
    private double decayFactor = 0.8D;

    /**
     * Providers scoring below this are excluded from ranking.
     */
    private double disableThreshold = 0.1D;

    /**
     * Consecutive failures tolerated before a provider enters cooldown.
     */
    private int retryBudget = 3;

    private long cooldownMs = 5000;

    /**
     * Upper bound of the random jitter added to scores when ranking.
     */
    private double tieJitter = 0.02D;

    private long flushIntervalMs = 10000;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Endpoint {

        private String name;

        private String displayName;

        /**
         * Supports {contentId}, {height} and {bitrate} placeholders.
         */
        private String urlTemplate;
    }
}
