package com.example.adaptivestream.common.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.content")
public class AppContentProperties {

    private String metadataUrlTemplate = "https://ipfs.io/api/v0/dag/get?arg={contentId}";

    private int validationTimeoutMs = 2000;

    /**
     * How long a successful validation is trusted.
     */
    private long validityHours = 48;

    /**
     * Content ids accepted without a metadata lookup.
     */
    private List<String> preloadedContentIds = new ArrayList<>();
}
