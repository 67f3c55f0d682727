package com.example.adaptivestream.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import lombok.Data;

@Data
public class QualityPreferenceRequest {

    /**
     * auto | manual
     */
    @NotBlank
    @Pattern(regexp = "(?i)auto|manual")
    private String mode;

    /**
     * Tier label such as "720p"; required for manual mode.
     */
    private String tier;
}
