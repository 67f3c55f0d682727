package com.example.adaptivestream.domain.model;

public enum BufferHealth {
    HEALTHY,
    LOW,
    STALLED
}
