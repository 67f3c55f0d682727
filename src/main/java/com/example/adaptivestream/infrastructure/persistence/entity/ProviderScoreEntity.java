package com.example.adaptivestream.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ProviderScoreEntity {

    private String providerName;

    private Double score;

    private Integer consecutiveFailures;

    private LocalDateTime updatedAt;
}
