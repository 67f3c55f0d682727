package com.example.adaptivestream.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProviderStatusResponse {

    private String name;
    private String displayName;
    private String urlTemplate;
    private Double score;
    private Integer consecutiveFailures;
    private Boolean disabled;
    private Boolean coolingDown;
    private Long cooldownUntilMs;
    private Long lastSuccessAtMs;
}
