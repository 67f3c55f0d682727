package com.example.adaptivestream.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.session")
public class AppSessionProperties {

    /**
     * Provider switches allowed per recovery episode before the session fails.
     */
    private int maxProviderRetries = 3;

    /**
     * Time a freshly selected provider has to refill the buffer to the minimum.
     */
    private long recoveryWindowMs = 1500;

    /**
     * Sessions without any API activity for this long are disposed.
     */
    private long idleTtlSec = 1800;

    private int eventLogCapacity = 100;

    private int maxSessions = 500;
}
