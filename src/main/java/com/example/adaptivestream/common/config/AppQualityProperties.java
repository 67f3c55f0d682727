package com.example.adaptivestream.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.quality")
public class AppQualityProperties {

    private List<Tier> tiers = new ArrayList<>(Arrays.asList(
            new Tier(400_000L, 360),
            new Tier(800_000L, 480),
            new Tier(1_500_000L, 720),
            new Tier(3_000_000L, 1080)));

    /**
     * Share of the effective bandwidth a tier bitrate may use.
     */
    private double bandwidthHeadroom = 0.8D;

    private long minSwitchIntervalMs = 5000;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tier {

        private long bitrate;

        private int height;
    }
}
