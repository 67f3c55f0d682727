package com.example.adaptivestream.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.security")
public class AppSecurityProperties {

    /**
     * Static bearer token accepted by the session and provider APIs.
     */
    private String apiToken = "dev-token";
}
