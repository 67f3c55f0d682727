package com.example.adaptivestream.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ValidatedContentEntity {

    private String contentId;

    private Double durationSec;

    private Long totalBytes;

    private LocalDateTime validatedAt;
}
